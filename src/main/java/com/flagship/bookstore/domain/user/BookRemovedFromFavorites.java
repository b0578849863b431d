package com.flagship.bookstore.domain.user;

import com.flagship.bookstore.domain.DomainEvent;
import lombok.Value;

import java.util.UUID;

@Value
public class BookRemovedFromFavorites implements DomainEvent {
    UUID userId;
    UUID bookId;

    public static final String EVENT_TYPE = "BookRemovedFromFavorites";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
