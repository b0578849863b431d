package com.flagship.bookstore.catalog.publisher;

import com.fasterxml.jackson.core.type.TypeReference;
import com.flagship.bookstore.cache.EntityKind;
import com.flagship.bookstore.cache.TaggedCache;
import com.flagship.bookstore.catalog.CacheSettings;
import com.flagship.bookstore.catalog.DocumentQueryService;
import com.flagship.bookstore.catalog.PagedResponse;
import com.flagship.bookstore.catalog.publisher.dto.PublisherResponse;
import com.flagship.bookstore.projection.ProjectionStore;
import com.flagship.bookstore.projection.catalog.PublisherDocument;
import com.flagship.bookstore.projection.catalog.PublisherStatisticsDocument;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;

@Service
public class PublisherQueryService extends DocumentQueryService<PublisherDocument, PublisherResponse> {

    public PublisherQueryService(ProjectionStore store, TaggedCache cache, CacheSettings settings) {
        super(store, cache, settings);
    }

    @Override
    protected EntityKind entityKind() {
        return EntityKind.PUBLISHER;
    }

    @Override
    protected Class<PublisherDocument> documentType() {
        return PublisherDocument.class;
    }

    @Override
    protected TypeReference<PublisherResponse> responseType() {
        return new TypeReference<>() {
        };
    }

    @Override
    protected TypeReference<PagedResponse<PublisherResponse>> pageType() {
        return new TypeReference<>() {
        };
    }

    @Override
    protected PublisherResponse toResponse(PublisherDocument document) {
        return PublisherResponse.from(document,
                store.find(PublisherStatisticsDocument.class, document.getId()).orElse(null));
    }

    @Override
    protected boolean matchesSearch(PublisherDocument document, String term) {
        return contains(document.getName(), term);
    }

    @Override
    protected Map<String, Comparator<PublisherDocument>> sortOrders() {
        Map<String, Comparator<PublisherDocument>> orders = new LinkedHashMap<>();
        orders.put("name", Comparator.comparing(PublisherDocument::getName, Comparator.nullsLast(String.CASE_INSENSITIVE_ORDER))
                .thenComparing(PublisherDocument::getId));
        orders.put("lastModified", Comparator.comparing(PublisherDocument::getLastModified)
                .thenComparing(PublisherDocument::getId));
        return orders;
    }
}
