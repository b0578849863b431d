package com.flagship.bookstore.domain.book;

import com.flagship.bookstore.domain.DomainEvent;
import lombok.Value;

import java.util.UUID;

/**
 * Event appended when the editable details of a book are replaced.
 */
@Value
public class BookUpdated implements DomainEvent {
    UUID bookId;
    BookDetails details;

    public static final String EVENT_TYPE = "BookUpdated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
