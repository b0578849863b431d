package com.flagship.bookstore.cache;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Deterministic cache key derived from the query shape.
 *
 * Collection keys sort their parameters by name, so the same query always maps to
 * the same key regardless of the order parameters were supplied in.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CacheKey {
    String value;

    public static CacheKey item(EntityKind kind, UUID id) {
        Objects.requireNonNull(id, "id");
        return new CacheKey(kind.getItemPrefix() + ":" + id);
    }

    /**
     * {@code {collectionTag}:{k=v;...}}. Null parameter values are written as empty strings.
     */
    public static CacheKey collection(EntityKind kind, Map<String, ?> parameters) {
        String query = new TreeMap<>(parameters).entrySet().stream()
                .map(e -> e.getKey() + "=" + (e.getValue() == null ? "" : e.getValue()))
                .collect(Collectors.joining(";"));
        return new CacheKey(kind.getCollectionTag() + ":" + query);
    }

    @Override
    public String toString() {
        return value;
    }
}
