package com.flagship.bookstore.domain.book;

import com.flagship.bookstore.domain.DomainEvent;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class BookSaleCancelled implements DomainEvent {
    UUID bookId;
    Instant saleStart;

    public static final String EVENT_TYPE = "BookSaleCancelled";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
