package com.flagship.bookstore.eventstore;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.bookstore.domain.DomainEvent;
import com.flagship.bookstore.projection.ProjectionChannel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * PostgreSQL-backed event store.
 *
 * Append flow:
 * 1. Read the current stream version and compare with the expected one
 * 2. Insert the new rows with consecutive versions
 * 3. A concurrent writer that passed step 1 too loses on the unique constraint
 * 4. After commit, the appended events are offered to the projection channel
 *
 * Payloads are stored as JSON; {@link EventTypeRegistry} resolves the class on read.
 */
@Component
@ConditionalOnProperty(name = "bookstore.store.type", havingValue = "jpa", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class JpaEventStore implements EventStore {

    private final StreamEventRepository repository;
    private final EventTypeRegistry eventTypes;
    private final ObjectMapper objectMapper;
    private final ProjectionChannel projectionChannel;
    private final Clock clock;

    @Override
    @Transactional
    public long append(UUID streamId, String streamType, long expectedVersion, List<? extends DomainEvent> events) {
        if (events == null || events.isEmpty()) {
            throw new IllegalArgumentException("At least one event is required");
        }

        long current = repository.findCurrentVersion(streamId).orElse(0L);
        if (current != expectedVersion) {
            throw new VersionConflictException(streamId, expectedVersion, current);
        }

        Instant now = clock.instant();
        List<StreamEventEntity> entities = new ArrayList<>(events.size());
        long version = current;
        for (DomainEvent event : events) {
            version++;
            entities.add(StreamEventEntity.create(
                    streamId, streamType, version, event.getEventType(), serialize(event), now));
        }

        List<StreamEventEntity> saved;
        try {
            saved = repository.saveAllAndFlush(entities);
        } catch (DataIntegrityViolationException e) {
            log.warn("Concurrent append detected: streamId={}, expectedVersion={}", streamId, expectedVersion);
            throw new VersionConflictException(streamId, expectedVersion, e);
        }

        List<StoredEvent> stored = new ArrayList<>(saved.size());
        for (int i = 0; i < saved.size(); i++) {
            StreamEventEntity entity = saved.get(i);
            stored.add(new StoredEvent(entity.getEventId(), streamId, streamType, entity.getVersion(),
                    entity.getSequenceNumber(), events.get(i), entity.getCreatedAt()));
        }

        log.info("Appended {} event(s) to {} stream {}: version {} -> {}",
                stored.size(), streamType, streamId, expectedVersion, version);

        publishAfterCommit(StreamAppended.of(streamId, streamType, stored));
        return version;
    }

    @Override
    @Transactional(readOnly = true)
    public List<StoredEvent> readStream(UUID streamId) {
        return repository.findByStreamIdOrderByVersionAsc(streamId)
                .stream()
                .map(this::toStoredEvent)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<StoredEvent> readAfter(long afterSequence, int limit) {
        return repository.findBySequenceNumberGreaterThanOrderBySequenceNumberAsc(afterSequence, PageRequest.of(0, limit))
                .stream()
                .map(this::toStoredEvent)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public long streamVersion(UUID streamId) {
        return repository.findCurrentVersion(streamId).orElse(0L);
    }

    /**
     * Projections must only see committed events, so the channel message waits for commit.
     */
    private void publishAfterCommit(StreamAppended appended) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            projectionChannel.publish(appended);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                projectionChannel.publish(appended);
            }
        });
    }

    private StoredEvent toStoredEvent(StreamEventEntity entity) {
        return new StoredEvent(
                entity.getEventId(),
                entity.getStreamId(),
                entity.getStreamType(),
                entity.getVersion(),
                entity.getSequenceNumber(),
                deserialize(entity.getEventType(), entity.getPayload()),
                entity.getCreatedAt()
        );
    }

    private String serialize(DomainEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize event " + event.getEventType(), e);
        }
    }

    private DomainEvent deserialize(String eventType, String payload) {
        try {
            return objectMapper.readValue(payload, eventTypes.resolve(eventType));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize stored event " + eventType, e);
        }
    }
}
