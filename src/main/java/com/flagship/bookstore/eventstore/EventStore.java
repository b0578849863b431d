package com.flagship.bookstore.eventstore;

import com.flagship.bookstore.domain.Aggregate;
import com.flagship.bookstore.domain.AggregateType;
import com.flagship.bookstore.domain.DomainEvent;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only, per-stream event storage with optimistic version checks.
 *
 * The conditional append is the only concurrency control on the write path:
 * callers pass the version they loaded, and a mismatch fails the whole append.
 * After a successful append the new events are offered to the projection channel.
 */
public interface EventStore {

    /**
     * Appends events atomically.
     *
     * @param streamId stream (aggregate) id
     * @param streamType aggregate type name
     * @param expectedVersion version the stream must be at; 0 for a new stream
     * @param events events to append, in order
     * @return the stream version after the append
     * @throws VersionConflictException if the stream is not at the expected version
     */
    long append(UUID streamId, String streamType, long expectedVersion, List<? extends DomainEvent> events);

    /**
     * Reads a stream in version order. Empty if the stream does not exist.
     */
    List<StoredEvent> readStream(UUID streamId);

    /**
     * Reads events across all streams with a sequence greater than the given one, in sequence order.
     */
    List<StoredEvent> readAfter(long afterSequence, int limit);

    /**
     * Current version of a stream, 0 if it does not exist.
     */
    long streamVersion(UUID streamId);

    /**
     * Folds a whole stream into an aggregate.
     *
     * @return the aggregate, or empty if the stream does not exist
     */
    default <A extends Aggregate<A>> Optional<A> load(AggregateType<A> type, UUID streamId) {
        List<StoredEvent> events = readStream(streamId);
        if (events.isEmpty()) {
            return Optional.empty();
        }
        A state = type.initial(streamId);
        for (StoredEvent event : events) {
            state = state.apply(event.getData(), event.getVersion());
        }
        return Optional.of(state);
    }
}
