package com.flagship.bookstore.eventstore;

import com.flagship.bookstore.domain.DomainEvent;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * An event as persisted in a stream, with the metadata assigned at append time.
 *
 * - version: 1-based position within the stream
 * - sequence: global append order across all streams
 */
@Value
public class StoredEvent {
    UUID eventId;
    UUID streamId;
    String streamType;
    long version;
    long sequence;
    DomainEvent data;
    Instant timestamp;

    public String getEventType() {
        return data.getEventType();
    }
}
