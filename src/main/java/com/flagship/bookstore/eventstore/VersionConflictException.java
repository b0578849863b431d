package com.flagship.bookstore.eventstore;

import lombok.Getter;

import java.util.UUID;

/**
 * Thrown when an append (or a conditional write at the API boundary) expected a
 * stream version other than the current one. Mapped to 412 Precondition Failed.
 */
@Getter
public class VersionConflictException extends RuntimeException {

    private final UUID streamId;
    private final long expectedVersion;
    private final Long actualVersion;

    public VersionConflictException(UUID streamId, long expectedVersion, long actualVersion) {
        super(String.format("Stream %s is at version %d, expected %d", streamId, actualVersion, expectedVersion));
        this.streamId = streamId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    /**
     * Used when a concurrent writer won the race and the current version is unknown.
     */
    public VersionConflictException(UUID streamId, long expectedVersion, Throwable cause) {
        super(String.format("Stream %s was modified concurrently, expected version %d", streamId, expectedVersion), cause);
        this.streamId = streamId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = null;
    }
}
