package com.flagship.bookstore.projection.catalog;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Book count of one publisher, keyed by the publisher id.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class PublisherStatisticsDocument implements BookCountDocument {
    UUID id;
    long version;
    boolean deleted;
    Instant lastModified;
    int bookCount;
    Map<UUID, Long> bookVersions;
    Set<UUID> bookIds;
}
