package com.flagship.bookstore.catalog;

/**
 * A response that carries the stream version it reflects, for the ETag header.
 */
public interface VersionedResponse {

    long getVersion();

    boolean isDeleted();

    /**
     * Version of the statistics document served with the entity, 0 if none.
     */
    default long getStatisticsVersion() {
        return 0;
    }
}
