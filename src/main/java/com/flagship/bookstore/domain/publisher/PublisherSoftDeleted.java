package com.flagship.bookstore.domain.publisher;

import com.flagship.bookstore.domain.DomainEvent;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class PublisherSoftDeleted implements DomainEvent {
    UUID publisherId;
    Instant deletedAt;

    public static final String EVENT_TYPE = "PublisherSoftDeleted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
