package com.flagship.bookstore.domain.tenant;

import com.flagship.bookstore.domain.Aggregate;
import com.flagship.bookstore.domain.AggregateType;
import com.flagship.bookstore.domain.DomainEvent;
import com.flagship.bookstore.domain.DomainValidationException;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

@Value
@Builder(toBuilder = true)
public class Tenant implements Aggregate<Tenant> {

    public static final AggregateType<Tenant> TYPE = new AggregateType<>("Tenant", Tenant::empty);

    private static final int MAX_NAME_LENGTH = 100;

    UUID id;
    long version;
    String name;
    boolean enabled;

    static Tenant empty(UUID id) {
        return new Tenant(id, 0, null, false);
    }

    public static TenantCreated create(UUID id, String name) {
        validateName(name);
        return new TenantCreated(id, name.trim());
    }

    public TenantUpdated update(String newName, boolean newEnabled) {
        validateName(newName);
        return new TenantUpdated(id, newName.trim(), newEnabled);
    }

    @Override
    public Tenant apply(DomainEvent event, long version) {
        if (event instanceof TenantCreated created) {
            return toBuilder().id(created.getTenantId()).name(created.getName())
                    .enabled(true).version(version).build();
        }
        if (event instanceof TenantUpdated updated) {
            return toBuilder().name(updated.getName()).enabled(updated.isEnabled()).version(version).build();
        }
        throw new IllegalArgumentException("Event " + event.getEventType() + " does not apply to Tenant");
    }

    private static void validateName(String name) {
        if (name == null || name.isBlank()) {
            throw new DomainValidationException("Tenant name is required");
        }
        if (name.trim().length() > MAX_NAME_LENGTH) {
            throw new DomainValidationException("Tenant name cannot exceed " + MAX_NAME_LENGTH + " characters");
        }
    }
}
