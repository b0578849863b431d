package com.flagship.bookstore.domain.category;

import com.flagship.bookstore.domain.DomainEvent;
import lombok.Value;

import java.util.Map;
import java.util.UUID;

/**
 * Event appended when a category is added. Names are keyed by culture.
 */
@Value
public class CategoryAdded implements DomainEvent {
    UUID categoryId;
    Map<String, String> names;

    public static final String EVENT_TYPE = "CategoryAdded";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
