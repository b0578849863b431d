package com.flagship.bookstore.domain.book;

import com.flagship.bookstore.domain.DomainEvent;
import lombok.Value;

import java.util.UUID;

@Value
public class BookCoverUpdated implements DomainEvent {
    UUID bookId;
    String coverImageUrl;

    public static final String EVENT_TYPE = "BookCoverUpdated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
