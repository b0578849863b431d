package com.flagship.bookstore.domain.publisher;

import com.flagship.bookstore.domain.DomainEvent;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class PublisherRestored implements DomainEvent {
    UUID publisherId;
    Instant restoredAt;

    public static final String EVENT_TYPE = "PublisherRestored";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
