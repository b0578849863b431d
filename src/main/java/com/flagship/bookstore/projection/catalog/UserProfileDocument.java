package com.flagship.bookstore.projection.catalog;

import com.flagship.bookstore.projection.ProjectionDocument;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Set;
import java.util.UUID;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class UserProfileDocument implements ProjectionDocument {
    UUID id;
    long version;
    boolean deleted;
    Instant lastModified;
    Set<UUID> favoriteBookIds;
}
