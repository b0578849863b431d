package com.flagship.bookstore.cache;

import com.fasterxml.jackson.core.type.TypeReference;

import java.time.Duration;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Read-through cache whose entries can be evicted in bulk by tag.
 */
public interface TaggedCache {

    /**
     * Returns the cached value, or computes, stores and returns it.
     *
     * A null result of the factory is returned but not cached.
     */
    <T> T getOrCreate(CacheKey key, TypeReference<T> type, Supplier<T> factory, Set<CacheTag> tags, Duration ttl);

    /**
     * Evicts every entry stored with the tag.
     *
     * @throws RuntimeException if the backend is unreachable; callers must log it as a stale-cache risk
     */
    void removeByTag(CacheTag tag);

    void clear();
}
