package com.flagship.bookstore.domain.book;

import com.flagship.bookstore.domain.DomainEvent;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class BookRestored implements DomainEvent {
    UUID bookId;
    Instant restoredAt;

    public static final String EVENT_TYPE = "BookRestored";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
