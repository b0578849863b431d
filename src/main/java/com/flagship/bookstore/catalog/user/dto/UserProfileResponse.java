package com.flagship.bookstore.catalog.user.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bookstore.catalog.VersionedResponse;
import com.flagship.bookstore.projection.catalog.UserProfileDocument;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
@Builder
@Jacksonized
public class UserProfileResponse implements VersionedResponse {

    @JsonProperty("user_id")
    UUID userId;

    @JsonProperty("version")
    long version;

    @JsonProperty("favorite_book_ids")
    List<UUID> favoriteBookIds;

    @JsonProperty("last_modified")
    Instant lastModified;

    @Override
    public boolean isDeleted() {
        return false;
    }

    public static UserProfileResponse from(UserProfileDocument document) {
        return UserProfileResponse.builder()
                .userId(document.getId())
                .version(document.getVersion())
                .favoriteBookIds(document.getFavoriteBookIds() == null
                        ? List.of()
                        : document.getFavoriteBookIds().stream().sorted().toList())
                .lastModified(document.getLastModified())
                .build();
    }
}
