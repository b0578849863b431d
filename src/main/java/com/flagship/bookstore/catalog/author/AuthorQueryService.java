package com.flagship.bookstore.catalog.author;

import com.fasterxml.jackson.core.type.TypeReference;
import com.flagship.bookstore.cache.EntityKind;
import com.flagship.bookstore.cache.TaggedCache;
import com.flagship.bookstore.catalog.CacheSettings;
import com.flagship.bookstore.catalog.DocumentQueryService;
import com.flagship.bookstore.catalog.PagedResponse;
import com.flagship.bookstore.catalog.author.dto.AuthorResponse;
import com.flagship.bookstore.projection.ProjectionStore;
import com.flagship.bookstore.projection.catalog.AuthorDocument;
import com.flagship.bookstore.projection.catalog.AuthorStatisticsDocument;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;

@Service
public class AuthorQueryService extends DocumentQueryService<AuthorDocument, AuthorResponse> {

    public AuthorQueryService(ProjectionStore store, TaggedCache cache, CacheSettings settings) {
        super(store, cache, settings);
    }

    @Override
    protected EntityKind entityKind() {
        return EntityKind.AUTHOR;
    }

    @Override
    protected Class<AuthorDocument> documentType() {
        return AuthorDocument.class;
    }

    @Override
    protected TypeReference<AuthorResponse> responseType() {
        return new TypeReference<>() {
        };
    }

    @Override
    protected TypeReference<PagedResponse<AuthorResponse>> pageType() {
        return new TypeReference<>() {
        };
    }

    @Override
    protected AuthorResponse toResponse(AuthorDocument document) {
        return AuthorResponse.from(document,
                store.find(AuthorStatisticsDocument.class, document.getId()).orElse(null));
    }

    @Override
    protected boolean matchesSearch(AuthorDocument document, String term) {
        return contains(document.getName(), term);
    }

    @Override
    protected Map<String, Comparator<AuthorDocument>> sortOrders() {
        Map<String, Comparator<AuthorDocument>> orders = new LinkedHashMap<>();
        orders.put("name", Comparator.comparing(AuthorDocument::getName, Comparator.nullsLast(String.CASE_INSENSITIVE_ORDER))
                .thenComparing(AuthorDocument::getId));
        orders.put("lastModified", Comparator.comparing(AuthorDocument::getLastModified)
                .thenComparing(AuthorDocument::getId));
        return orders;
    }
}
