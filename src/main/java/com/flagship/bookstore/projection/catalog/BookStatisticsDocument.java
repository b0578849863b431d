package com.flagship.bookstore.projection.catalog;

import com.flagship.bookstore.projection.ProjectionDocument;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Per-book like count aggregated from every user profile stream.
 *
 * The document has its own id derived from the book id; {@code bookId} points at the parent.
 * {@code sourceVersions} records, per user stream, the version of the latest favorite event
 * about this book; {@code likedBy} holds the users whose latest such event is an add.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class BookStatisticsDocument implements ProjectionDocument {
    UUID id;
    UUID bookId;
    long version;
    boolean deleted;
    Instant lastModified;
    int likeCount;
    Map<UUID, Long> sourceVersions;
    Set<UUID> likedBy;

    public static UUID idFor(UUID bookId) {
        return UUID.nameUUIDFromBytes(("book-statistics:" + bookId).getBytes(StandardCharsets.UTF_8));
    }
}
