package com.flagship.bookstore.catalog.publisher.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bookstore.catalog.VersionedResponse;
import com.flagship.bookstore.projection.catalog.PublisherDocument;
import com.flagship.bookstore.projection.catalog.PublisherStatisticsDocument;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
@Jacksonized
public class PublisherResponse implements VersionedResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("version")
    long version;

    @JsonProperty("deleted")
    boolean deleted;

    @JsonProperty("deleted_at")
    Instant deletedAt;

    @JsonProperty("name")
    String name;

    @JsonProperty("book_count")
    int bookCount;

    @JsonProperty("statistics_version")
    long statisticsVersion;

    @JsonProperty("last_modified")
    Instant lastModified;

    public static PublisherResponse from(PublisherDocument document, PublisherStatisticsDocument statistics) {
        return PublisherResponse.builder()
                .id(document.getId())
                .version(document.getVersion())
                .deleted(document.isDeleted())
                .deletedAt(document.getDeletedAt())
                .name(document.getName())
                .bookCount(statistics == null ? 0 : statistics.getBookCount())
                .statisticsVersion(statistics == null ? 0 : statistics.getVersion())
                .lastModified(document.getLastModified())
                .build();
    }
}
