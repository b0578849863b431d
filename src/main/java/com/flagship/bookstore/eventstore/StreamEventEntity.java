package com.flagship.bookstore.eventstore;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for one row of the event log.
 *
 * The unique (stream_id, version) constraint makes a racing append fail at
 * insert time even when both writers passed the version check.
 */
@Entity
@Table(name = "stream_events",
        uniqueConstraints = @UniqueConstraint(name = "uk_stream_events_stream_version",
                columnNames = {"stream_id", "version"}),
        indexes = @Index(name = "idx_stream_events_stream", columnList = "stream_id"))
@Getter
@Setter
@NoArgsConstructor
public class StreamEventEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "sequence_number", nullable = false, updatable = false)
    private Long sequenceNumber;

    @Column(name = "event_id", nullable = false, unique = true, updatable = false)
    private UUID eventId;

    @Column(name = "stream_id", nullable = false, updatable = false)
    private UUID streamId;

    @Column(name = "stream_type", nullable = false, length = 100)
    private String streamType;

    @Column(name = "version", nullable = false, updatable = false)
    private long version;

    @Column(name = "event_type", nullable = false, length = 100)
    private String eventType;

    @Column(name = "payload", nullable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String payload;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public static StreamEventEntity create(UUID streamId, String streamType, long version,
                                           String eventType, String payload, Instant createdAt) {
        StreamEventEntity entity = new StreamEventEntity();
        entity.setEventId(UUID.randomUUID());
        entity.setStreamId(streamId);
        entity.setStreamType(streamType);
        entity.setVersion(version);
        entity.setEventType(eventType);
        entity.setPayload(payload);
        entity.setCreatedAt(createdAt);
        return entity;
    }
}
