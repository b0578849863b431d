package com.flagship.bookstore.catalog;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Shape of a list request. Its parameters form the collection cache key.
 */
@Value
@Builder
public class ListQuery {

    public static final int MAX_PAGE_SIZE = 100;

    int page;
    int size;
    String search;
    String sort;
    boolean includeDeleted;
    @Singular
    Map<String, String> filters;

    /**
     * @throws IllegalArgumentException if page or size are out of range
     */
    public void validate() {
        if (page < 0) {
            throw new IllegalArgumentException("Page cannot be negative");
        }
        if (size < 1 || size > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("Page size must be between 1 and " + MAX_PAGE_SIZE);
        }
    }

    public String filter(String name) {
        return filters.get(name);
    }

    public boolean hasSearch() {
        return search != null && !search.isBlank();
    }

    public Map<String, Object> cacheParameters() {
        Map<String, Object> parameters = new LinkedHashMap<>(filters);
        parameters.put("page", page);
        parameters.put("size", size);
        parameters.put("search", hasSearch() ? search.trim().toLowerCase(Locale.ROOT) : null);
        parameters.put("sort", sort);
        parameters.put("includeDeleted", includeDeleted);
        return parameters;
    }
}
