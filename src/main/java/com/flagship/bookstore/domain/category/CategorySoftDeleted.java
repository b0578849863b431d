package com.flagship.bookstore.domain.category;

import com.flagship.bookstore.domain.DomainEvent;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class CategorySoftDeleted implements DomainEvent {
    UUID categoryId;
    Instant deletedAt;

    public static final String EVENT_TYPE = "CategorySoftDeleted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
