package com.flagship.bookstore.catalog.category.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bookstore.catalog.VersionedResponse;
import com.flagship.bookstore.projection.catalog.CategoryDocument;
import com.flagship.bookstore.projection.catalog.CategoryStatisticsDocument;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Value
@Builder
@Jacksonized
public class CategoryResponse implements VersionedResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("version")
    long version;

    @JsonProperty("deleted")
    boolean deleted;

    @JsonProperty("deleted_at")
    Instant deletedAt;

    @JsonProperty("names")
    Map<String, String> names;

    @JsonProperty("book_count")
    int bookCount;

    @JsonProperty("statistics_version")
    long statisticsVersion;

    @JsonProperty("last_modified")
    Instant lastModified;

    public static CategoryResponse from(CategoryDocument document, CategoryStatisticsDocument statistics) {
        return CategoryResponse.builder()
                .id(document.getId())
                .version(document.getVersion())
                .deleted(document.isDeleted())
                .deletedAt(document.getDeletedAt())
                .names(document.getNames())
                .bookCount(statistics == null ? 0 : statistics.getBookCount())
                .statisticsVersion(statistics == null ? 0 : statistics.getVersion())
                .lastModified(document.getLastModified())
                .build();
    }
}
