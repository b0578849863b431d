package com.flagship.bookstore.domain.publisher;

import com.flagship.bookstore.domain.Aggregate;
import com.flagship.bookstore.domain.AggregateType;
import com.flagship.bookstore.domain.DomainConflictException;
import com.flagship.bookstore.domain.DomainEvent;
import com.flagship.bookstore.domain.DomainValidationException;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder(toBuilder = true)
public class Publisher implements Aggregate<Publisher> {

    public static final AggregateType<Publisher> TYPE = new AggregateType<>("Publisher", Publisher::empty);

    private static final int MAX_NAME_LENGTH = 200;

    UUID id;
    long version;
    String name;
    boolean deleted;

    static Publisher empty(UUID id) {
        return new Publisher(id, 0, null, false);
    }

    public static PublisherAdded create(UUID id, String name) {
        validateName(name);
        return new PublisherAdded(id, name.trim());
    }

    public PublisherUpdated update(String newName) {
        if (deleted) {
            throw new DomainConflictException("Cannot update a deleted publisher");
        }
        validateName(newName);
        return new PublisherUpdated(id, newName.trim());
    }

    public PublisherSoftDeleted softDelete(Instant timestamp) {
        if (deleted) {
            throw new DomainConflictException("Publisher is already deleted");
        }
        return new PublisherSoftDeleted(id, timestamp);
    }

    public PublisherRestored restore(Instant timestamp) {
        if (!deleted) {
            throw new DomainConflictException("Publisher is not deleted");
        }
        return new PublisherRestored(id, timestamp);
    }

    @Override
    public Publisher apply(DomainEvent event, long version) {
        if (event instanceof PublisherAdded added) {
            return toBuilder().id(added.getPublisherId()).name(added.getName())
                    .deleted(false).version(version).build();
        }
        if (event instanceof PublisherUpdated updated) {
            return toBuilder().name(updated.getName()).version(version).build();
        }
        if (event instanceof PublisherSoftDeleted) {
            return toBuilder().deleted(true).version(version).build();
        }
        if (event instanceof PublisherRestored) {
            return toBuilder().deleted(false).version(version).build();
        }
        throw new IllegalArgumentException("Event " + event.getEventType() + " does not apply to Publisher");
    }

    private static void validateName(String name) {
        if (name == null || name.isBlank()) {
            throw new DomainValidationException("Publisher name is required");
        }
        if (name.trim().length() > MAX_NAME_LENGTH) {
            throw new DomainValidationException("Publisher name cannot exceed " + MAX_NAME_LENGTH + " characters");
        }
    }
}
