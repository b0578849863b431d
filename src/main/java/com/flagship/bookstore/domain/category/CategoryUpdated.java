package com.flagship.bookstore.domain.category;

import com.flagship.bookstore.domain.DomainEvent;
import lombok.Value;

import java.util.Map;
import java.util.UUID;

@Value
public class CategoryUpdated implements DomainEvent {
    UUID categoryId;
    Map<String, String> names;

    public static final String EVENT_TYPE = "CategoryUpdated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
