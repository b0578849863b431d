package com.flagship.bookstore.domain;

import lombok.Value;

import java.util.UUID;
import java.util.function.Function;

/**
 * Describes how to rebuild an aggregate: its stream type name and its empty initial state.
 */
@Value
public class AggregateType<A extends Aggregate<A>> {
    String name;
    Function<UUID, A> initialState;

    public A initial(UUID id) {
        return initialState.apply(id);
    }
}
