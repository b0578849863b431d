package com.flagship.bookstore.domain.author;

import com.flagship.bookstore.domain.DomainEvent;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class AuthorSoftDeleted implements DomainEvent {
    UUID authorId;
    Instant deletedAt;

    public static final String EVENT_TYPE = "AuthorSoftDeleted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
