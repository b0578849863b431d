package com.flagship.bookstore.projection.catalog;

import com.flagship.bookstore.projection.ProjectionDocument;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class CategoryDocument implements ProjectionDocument {
    UUID id;
    long version;
    boolean deleted;
    Instant deletedAt;
    Instant lastModified;
    Map<String, String> names;

    /**
     * Name in the requested culture, falling back to any available name.
     */
    public String nameFor(String culture) {
        if (culture != null && names.containsKey(culture)) {
            return names.get(culture);
        }
        return names.values().stream().findFirst().orElse(null);
    }
}
