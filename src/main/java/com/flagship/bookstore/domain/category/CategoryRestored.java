package com.flagship.bookstore.domain.category;

import com.flagship.bookstore.domain.DomainEvent;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class CategoryRestored implements DomainEvent {
    UUID categoryId;
    Instant restoredAt;

    public static final String EVENT_TYPE = "CategoryRestored";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
