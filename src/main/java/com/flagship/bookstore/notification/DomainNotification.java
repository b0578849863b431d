package com.flagship.bookstore.notification;

import com.flagship.bookstore.projection.ChangeKind;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.UUID;

/**
 * Informational record of a projected entity change.
 *
 * Never authoritative: clients re-fetch the entity to see its state. {@code version} is the
 * entity's stream version and {@code etag} the tag its GET carries after the change.
 */
@Value
@Builder
@Jacksonized
public class DomainNotification {
    UUID eventId;
    String eventType;
    String entityType;
    UUID entityId;
    ChangeKind changeKind;
    String name;
    Instant timestamp;
    long version;
    String etag;
}
