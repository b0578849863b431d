package com.flagship.bookstore.domain.user;

import com.flagship.bookstore.domain.DomainEvent;
import lombok.Value;

import java.util.UUID;

/**
 * Appended to a user profile stream. Also feeds the per-book like count.
 */
@Value
public class BookAddedToFavorites implements DomainEvent {
    UUID userId;
    UUID bookId;

    public static final String EVENT_TYPE = "BookAddedToFavorites";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
