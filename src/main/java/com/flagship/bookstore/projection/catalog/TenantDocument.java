package com.flagship.bookstore.projection.catalog;

import com.flagship.bookstore.projection.ProjectionDocument;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class TenantDocument implements ProjectionDocument {
    UUID id;
    long version;
    boolean deleted;
    Instant lastModified;
    String name;
    boolean enabled;
}
