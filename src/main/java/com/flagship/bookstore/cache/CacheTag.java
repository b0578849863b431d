package com.flagship.bookstore.cache;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Objects;
import java.util.UUID;

/**
 * Invalidation tag. Only built through {@link #item} and {@link #collection}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CacheTag {
    String value;

    /**
     * {@code {prefix}:{id}}, e.g. {@code book:3f2c...}.
     */
    public static CacheTag item(EntityKind kind, UUID id) {
        Objects.requireNonNull(id, "id");
        return new CacheTag(kind.getItemPrefix() + ":" + id);
    }

    /**
     * The collection tag, e.g. {@code booksList}.
     */
    public static CacheTag collection(EntityKind kind) {
        return new CacheTag(kind.getCollectionTag());
    }

    @Override
    public String toString() {
        return value;
    }
}
