package com.flagship.bookstore.domain;

/**
 * Base interface for events appended to aggregate streams.
 *
 * Events are facts: they are never updated or deleted. Stream id, version,
 * global sequence and timestamp are assigned by the event store and travel
 * next to the event rather than inside it.
 */
public interface DomainEvent {

    /**
     * Event type name used for storage and routing.
     */
    String getEventType();
}
