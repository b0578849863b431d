package com.flagship.bookstore.catalog;

import com.flagship.bookstore.domain.Aggregate;
import com.flagship.bookstore.domain.AggregateType;
import com.flagship.bookstore.domain.DomainEvent;
import com.flagship.bookstore.domain.EntityNotFoundException;
import com.flagship.bookstore.eventstore.EventStore;
import com.flagship.bookstore.eventstore.VersionConflictException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;
import java.util.function.Function;

/**
 * Runs the load, decide, append cycle for a command.
 *
 * 1. Load the aggregate by folding its stream
 * 2. Compare the client's expected version (from If-Match) with the loaded one
 * 3. Let the aggregate validate and produce the event
 * 4. Append with the loaded version as the expected version
 *
 * A concurrent writer between steps 1 and 4 makes the append fail with
 * {@link VersionConflictException}; nothing is retried here, the client decides.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AggregateCommandExecutor {

    private final EventStore eventStore;

    /**
     * Starts a new stream with its first event.
     */
    public CommandResult start(AggregateType<?> type, UUID id, DomainEvent event) {
        long version = eventStore.append(id, type.getName(), 0, List.of(event));
        log.info("Started {} stream {} with {}", type.getName(), id, event.getEventType());
        return new CommandResult(id, version);
    }

    /**
     * Applies a command to an existing aggregate.
     *
     * @param expectedVersion version the client last observed, or null for an unconditional write
     * @throws EntityNotFoundException if the stream does not exist
     * @throws VersionConflictException if the stream is not at the expected version
     */
    public <A extends Aggregate<A>> CommandResult execute(AggregateType<A> type, UUID id, Long expectedVersion,
                                                          Function<A, ? extends DomainEvent> command) {
        A aggregate = eventStore.load(type, id)
                .orElseThrow(() -> new EntityNotFoundException(type.getName(), id));
        return decideAndAppend(type, aggregate, expectedVersion, command);
    }

    /**
     * Like {@link #execute}, but a missing stream starts from the aggregate's initial state.
     * For aggregates without a creation event, such as user profiles.
     */
    public <A extends Aggregate<A>> CommandResult upsert(AggregateType<A> type, UUID id, Long expectedVersion,
                                                         Function<A, ? extends DomainEvent> command) {
        A aggregate = eventStore.load(type, id).orElseGet(() -> type.initial(id));
        return decideAndAppend(type, aggregate, expectedVersion, command);
    }

    private <A extends Aggregate<A>> CommandResult decideAndAppend(AggregateType<A> type, A aggregate,
                                                                   Long expectedVersion,
                                                                   Function<A, ? extends DomainEvent> command) {
        if (expectedVersion != null && expectedVersion != aggregate.getVersion()) {
            throw new VersionConflictException(aggregate.getId(), expectedVersion, aggregate.getVersion());
        }

        DomainEvent event = command.apply(aggregate);
        long version = eventStore.append(aggregate.getId(), type.getName(), aggregate.getVersion(), List.of(event));
        log.info("Applied {} to {} stream {}: version {} -> {}",
                event.getEventType(), type.getName(), aggregate.getId(), aggregate.getVersion(), version);
        return new CommandResult(aggregate.getId(), version);
    }
}
