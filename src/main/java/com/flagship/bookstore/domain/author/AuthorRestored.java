package com.flagship.bookstore.domain.author;

import com.flagship.bookstore.domain.DomainEvent;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class AuthorRestored implements DomainEvent {
    UUID authorId;
    Instant restoredAt;

    public static final String EVENT_TYPE = "AuthorRestored";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
