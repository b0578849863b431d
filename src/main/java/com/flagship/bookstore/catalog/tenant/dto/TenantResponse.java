package com.flagship.bookstore.catalog.tenant.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bookstore.catalog.VersionedResponse;
import com.flagship.bookstore.projection.catalog.TenantDocument;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
@Jacksonized
public class TenantResponse implements VersionedResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("version")
    long version;

    @JsonProperty("deleted")
    boolean deleted;

    @JsonProperty("name")
    String name;

    @JsonProperty("enabled")
    boolean enabled;

    @JsonProperty("last_modified")
    Instant lastModified;

    public static TenantResponse from(TenantDocument document) {
        return TenantResponse.builder()
                .id(document.getId())
                .version(document.getVersion())
                .deleted(document.isDeleted())
                .name(document.getName())
                .enabled(document.isEnabled())
                .lastModified(document.getLastModified())
                .build();
    }
}
