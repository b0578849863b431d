package com.flagship.bookstore.eventstore;

import com.flagship.bookstore.domain.DomainEvent;
import com.flagship.bookstore.projection.ProjectionChannel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Event store kept in memory, for a single instance (dev profile and tests).
 *
 * The version check and the append run inside one {@code compute} on the stream,
 * so concurrent appends to the same stream are serialized and exactly one of
 * several writers with the same expected version succeeds.
 */
@Component
@ConditionalOnProperty(name = "bookstore.store.type", havingValue = "memory")
@Slf4j
public class InMemoryEventStore implements EventStore {

    private final ProjectionChannel projectionChannel;
    private final Clock clock;

    private final Map<UUID, List<StoredEvent>> streams = new ConcurrentHashMap<>();
    private final ConcurrentSkipListMap<Long, StoredEvent> allEvents = new ConcurrentSkipListMap<>();
    private final AtomicLong sequence = new AtomicLong(0);

    public InMemoryEventStore(ProjectionChannel projectionChannel, Clock clock) {
        this.projectionChannel = projectionChannel;
        this.clock = clock;
    }

    @Override
    public long append(UUID streamId, String streamType, long expectedVersion, List<? extends DomainEvent> events) {
        if (events == null || events.isEmpty()) {
            throw new IllegalArgumentException("At least one event is required");
        }

        List<StoredEvent> appended = new ArrayList<>(events.size());
        streams.compute(streamId, (id, existing) -> {
            long current = existing == null ? 0 : existing.size();
            if (current != expectedVersion) {
                throw new VersionConflictException(streamId, expectedVersion, current);
            }
            List<StoredEvent> next = existing == null ? new ArrayList<>() : new ArrayList<>(existing);
            Instant now = clock.instant();
            long version = current;
            for (DomainEvent event : events) {
                version++;
                StoredEvent stored = new StoredEvent(
                        UUID.randomUUID(), streamId, streamType, version, sequence.incrementAndGet(), event, now);
                next.add(stored);
                appended.add(stored);
                allEvents.put(stored.getSequence(), stored);
            }
            // published under the stream lock so channel order matches version order
            projectionChannel.publish(StreamAppended.of(streamId, streamType, appended));
            return List.copyOf(next);
        });

        long newVersion = appended.get(appended.size() - 1).getVersion();
        log.info("Appended {} event(s) to {} stream {}: version {} -> {}",
                appended.size(), streamType, streamId, expectedVersion, newVersion);
        return newVersion;
    }

    @Override
    public List<StoredEvent> readStream(UUID streamId) {
        return streams.getOrDefault(streamId, List.of());
    }

    @Override
    public List<StoredEvent> readAfter(long afterSequence, int limit) {
        return allEvents.tailMap(afterSequence, false).values().stream()
                .limit(limit)
                .toList();
    }

    @Override
    public long streamVersion(UUID streamId) {
        return readStream(streamId).size();
    }
}
