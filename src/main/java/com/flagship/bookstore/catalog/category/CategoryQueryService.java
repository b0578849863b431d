package com.flagship.bookstore.catalog.category;

import com.fasterxml.jackson.core.type.TypeReference;
import com.flagship.bookstore.cache.EntityKind;
import com.flagship.bookstore.cache.TaggedCache;
import com.flagship.bookstore.catalog.CacheSettings;
import com.flagship.bookstore.catalog.DocumentQueryService;
import com.flagship.bookstore.catalog.PagedResponse;
import com.flagship.bookstore.catalog.category.dto.CategoryResponse;
import com.flagship.bookstore.projection.ProjectionStore;
import com.flagship.bookstore.projection.catalog.CategoryDocument;
import com.flagship.bookstore.projection.catalog.CategoryStatisticsDocument;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Category reads. Search matches a name in any culture; the default order uses the English name.
 */
@Service
public class CategoryQueryService extends DocumentQueryService<CategoryDocument, CategoryResponse> {

    private static final String SORT_CULTURE = "en";

    public CategoryQueryService(ProjectionStore store, TaggedCache cache, CacheSettings settings) {
        super(store, cache, settings);
    }

    @Override
    protected EntityKind entityKind() {
        return EntityKind.CATEGORY;
    }

    @Override
    protected Class<CategoryDocument> documentType() {
        return CategoryDocument.class;
    }

    @Override
    protected TypeReference<CategoryResponse> responseType() {
        return new TypeReference<>() {
        };
    }

    @Override
    protected TypeReference<PagedResponse<CategoryResponse>> pageType() {
        return new TypeReference<>() {
        };
    }

    @Override
    protected CategoryResponse toResponse(CategoryDocument document) {
        return CategoryResponse.from(document,
                store.find(CategoryStatisticsDocument.class, document.getId()).orElse(null));
    }

    @Override
    protected boolean matchesSearch(CategoryDocument document, String term) {
        return document.getNames().values().stream().anyMatch(name -> contains(name, term));
    }

    @Override
    protected Map<String, Comparator<CategoryDocument>> sortOrders() {
        Map<String, Comparator<CategoryDocument>> orders = new LinkedHashMap<>();
        orders.put("name", Comparator.comparing((CategoryDocument d) -> d.nameFor(SORT_CULTURE),
                        Comparator.nullsLast(String.CASE_INSENSITIVE_ORDER))
                .thenComparing(CategoryDocument::getId));
        orders.put("lastModified", Comparator.comparing(CategoryDocument::getLastModified)
                .thenComparing(CategoryDocument::getId));
        return orders;
    }
}
