package com.flagship.bookstore.domain.author;

import com.flagship.bookstore.domain.DomainEvent;
import lombok.Value;

import java.util.Map;
import java.util.UUID;

/**
 * Event appended when an author is added. Biographies are keyed by culture.
 */
@Value
public class AuthorAdded implements DomainEvent {
    UUID authorId;
    String name;
    Map<String, String> biographies;

    public static final String EVENT_TYPE = "AuthorAdded";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
