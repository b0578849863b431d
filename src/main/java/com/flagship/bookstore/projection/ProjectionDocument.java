package com.flagship.bookstore.projection;

import java.time.Instant;
import java.util.UUID;

/**
 * A read-optimized document derived from one or more event streams.
 *
 * Consumers never write documents; only projections do, by folding events.
 */
public interface ProjectionDocument {

    UUID getId();

    /**
     * Version of the source stream this document reflects. Read endpoints expose it as the ETag.
     */
    long getVersion();

    /**
     * Soft-delete flag. Deleted documents stay in the store so they can be restored.
     */
    boolean isDeleted();

    Instant getLastModified();
}
