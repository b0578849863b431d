package com.flagship.bookstore.eventstore;

import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * Message sent on the projection channel after events were durably appended to a stream.
 */
@Value
public class StreamAppended {
    UUID streamId;
    String streamType;
    List<StoredEvent> events;
    int attempt;

    public static StreamAppended of(UUID streamId, String streamType, List<StoredEvent> events) {
        return new StreamAppended(streamId, streamType, List.copyOf(events), 0);
    }

    /**
     * Returns a copy to re-queue after a failed projection run.
     */
    public StreamAppended nextAttempt() {
        return new StreamAppended(streamId, streamType, events, attempt + 1);
    }
}
