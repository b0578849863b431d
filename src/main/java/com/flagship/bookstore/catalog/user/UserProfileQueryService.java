package com.flagship.bookstore.catalog.user;

import com.fasterxml.jackson.core.type.TypeReference;
import com.flagship.bookstore.cache.EntityKind;
import com.flagship.bookstore.cache.TaggedCache;
import com.flagship.bookstore.catalog.CacheSettings;
import com.flagship.bookstore.catalog.DocumentQueryService;
import com.flagship.bookstore.catalog.PagedResponse;
import com.flagship.bookstore.catalog.user.dto.UserProfileResponse;
import com.flagship.bookstore.projection.ProjectionStore;
import com.flagship.bookstore.projection.catalog.UserProfileDocument;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.Map;

/**
 * Profile reads. Profiles are only exposed one at a time; a user without favorites has no profile yet.
 */
@Service
public class UserProfileQueryService extends DocumentQueryService<UserProfileDocument, UserProfileResponse> {

    public UserProfileQueryService(ProjectionStore store, TaggedCache cache, CacheSettings settings) {
        super(store, cache, settings);
    }

    @Override
    protected EntityKind entityKind() {
        return EntityKind.USER;
    }

    @Override
    protected Class<UserProfileDocument> documentType() {
        return UserProfileDocument.class;
    }

    @Override
    protected TypeReference<UserProfileResponse> responseType() {
        return new TypeReference<>() {
        };
    }

    @Override
    protected TypeReference<PagedResponse<UserProfileResponse>> pageType() {
        return new TypeReference<>() {
        };
    }

    @Override
    protected UserProfileResponse toResponse(UserProfileDocument document) {
        return UserProfileResponse.from(document);
    }

    @Override
    protected boolean matchesSearch(UserProfileDocument document, String term) {
        return false;
    }

    @Override
    protected Map<String, Comparator<UserProfileDocument>> sortOrders() {
        return Map.of("id", Comparator.comparing(UserProfileDocument::getId));
    }
}
