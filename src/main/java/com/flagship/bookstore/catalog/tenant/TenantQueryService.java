package com.flagship.bookstore.catalog.tenant;

import com.fasterxml.jackson.core.type.TypeReference;
import com.flagship.bookstore.cache.EntityKind;
import com.flagship.bookstore.cache.TaggedCache;
import com.flagship.bookstore.catalog.CacheSettings;
import com.flagship.bookstore.catalog.DocumentQueryService;
import com.flagship.bookstore.catalog.PagedResponse;
import com.flagship.bookstore.catalog.tenant.dto.TenantResponse;
import com.flagship.bookstore.projection.ProjectionStore;
import com.flagship.bookstore.projection.catalog.TenantDocument;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;

@Service
public class TenantQueryService extends DocumentQueryService<TenantDocument, TenantResponse> {

    public TenantQueryService(ProjectionStore store, TaggedCache cache, CacheSettings settings) {
        super(store, cache, settings);
    }

    @Override
    protected EntityKind entityKind() {
        return EntityKind.TENANT;
    }

    @Override
    protected Class<TenantDocument> documentType() {
        return TenantDocument.class;
    }

    @Override
    protected TypeReference<TenantResponse> responseType() {
        return new TypeReference<>() {
        };
    }

    @Override
    protected TypeReference<PagedResponse<TenantResponse>> pageType() {
        return new TypeReference<>() {
        };
    }

    @Override
    protected TenantResponse toResponse(TenantDocument document) {
        return TenantResponse.from(document);
    }

    @Override
    protected boolean matchesSearch(TenantDocument document, String term) {
        return contains(document.getName(), term);
    }

    @Override
    protected Map<String, Comparator<TenantDocument>> sortOrders() {
        Map<String, Comparator<TenantDocument>> orders = new LinkedHashMap<>();
        orders.put("name", Comparator.comparing(TenantDocument::getName, Comparator.nullsLast(String.CASE_INSENSITIVE_ORDER))
                .thenComparing(TenantDocument::getId));
        return orders;
    }
}
