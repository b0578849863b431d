package com.flagship.bookstore.domain.book;

import com.flagship.bookstore.domain.DomainEvent;
import lombok.Value;

import java.util.UUID;

/**
 * Event appended when a discount window is scheduled for a book.
 */
@Value
public class BookSaleScheduled implements DomainEvent {
    UUID bookId;
    BookSale sale;

    public static final String EVENT_TYPE = "BookSaleScheduled";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
