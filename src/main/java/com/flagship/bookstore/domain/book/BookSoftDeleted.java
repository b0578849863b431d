package com.flagship.bookstore.domain.book;

import com.flagship.bookstore.domain.DomainEvent;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Event appended when a book is hidden from the catalog. The stream is kept.
 */
@Value
public class BookSoftDeleted implements DomainEvent {
    UUID bookId;
    Instant deletedAt;

    public static final String EVENT_TYPE = "BookSoftDeleted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
