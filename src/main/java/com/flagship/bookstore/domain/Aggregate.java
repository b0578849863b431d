package com.flagship.bookstore.domain;

import java.util.UUID;

/**
 * An immutable aggregate reconstructed by folding its event stream.
 *
 * Mutator methods never change state. They validate invariants and return
 * the event to append; the new state only exists after the event store has
 * accepted the event and {@link #apply} folds it in.
 *
 * @param <A> the concrete aggregate type
 */
public interface Aggregate<A extends Aggregate<A>> {

    UUID getId();

    /**
     * Stream version this state reflects (number of events folded).
     */
    long getVersion();

    /**
     * Returns a new instance with the event folded in.
     *
     * @param event the event to fold
     * @param version stream version of the event
     * @throws IllegalArgumentException if the event does not belong to this aggregate
     */
    A apply(DomainEvent event, long version);
}
