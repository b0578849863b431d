package com.flagship.bookstore.domain.tenant;

import com.flagship.bookstore.domain.DomainEvent;
import lombok.Value;

import java.util.UUID;

@Value
public class TenantCreated implements DomainEvent {
    UUID tenantId;
    String name;

    public static final String EVENT_TYPE = "TenantCreated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
