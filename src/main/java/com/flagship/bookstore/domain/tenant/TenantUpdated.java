package com.flagship.bookstore.domain.tenant;

import com.flagship.bookstore.domain.DomainEvent;
import lombok.Value;

import java.util.UUID;

@Value
public class TenantUpdated implements DomainEvent {
    UUID tenantId;
    String name;
    boolean enabled;

    public static final String EVENT_TYPE = "TenantUpdated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
