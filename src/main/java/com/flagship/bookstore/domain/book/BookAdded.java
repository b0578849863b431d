package com.flagship.bookstore.domain.book;

import com.flagship.bookstore.domain.DomainEvent;
import lombok.Value;

import java.util.UUID;

/**
 * Event appended when a book is first added to the catalog.
 * Always the first event of a book stream.
 */
@Value
public class BookAdded implements DomainEvent {
    UUID bookId;
    BookDetails details;

    public static final String EVENT_TYPE = "BookAdded";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
