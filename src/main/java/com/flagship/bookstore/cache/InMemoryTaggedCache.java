package com.flagship.bookstore.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Process-local tagged cache for single-instance runs and tests.
 *
 * Values are held by reference; cached responses are immutable.
 */
@Component
@ConditionalOnProperty(name = "bookstore.cache.type", havingValue = "memory")
@RequiredArgsConstructor
@Slf4j
public class InMemoryTaggedCache implements TaggedCache {

    private final Clock clock;

    private final Map<CacheKey, Entry> entries = new ConcurrentHashMap<>();
    private final Map<CacheTag, Set<CacheKey>> keysByTag = new ConcurrentHashMap<>();

    @Override
    @SuppressWarnings("unchecked")
    public <T> T getOrCreate(CacheKey key, TypeReference<T> type, Supplier<T> factory, Set<CacheTag> tags, Duration ttl) {
        Instant now = clock.instant();
        Entry entry = entries.get(key);
        if (entry != null && entry.expiresAt.isAfter(now)) {
            log.debug("Cache hit: key={}", key);
            return (T) entry.value;
        }

        T value = factory.get();
        if (value == null) {
            return null;
        }
        entries.put(key, new Entry(value, now.plus(ttl)));
        for (CacheTag tag : tags) {
            keysByTag.computeIfAbsent(tag, t -> ConcurrentHashMap.newKeySet()).add(key);
        }
        return value;
    }

    @Override
    public void removeByTag(CacheTag tag) {
        Set<CacheKey> keys = keysByTag.remove(tag);
        if (keys == null) {
            return;
        }
        keys.forEach(entries::remove);
        log.debug("Invalidated tag {}: {} entr(ies)", tag, keys.size());
    }

    @Override
    public void clear() {
        entries.clear();
        keysByTag.clear();
    }

    public boolean contains(CacheKey key) {
        Entry entry = entries.get(key);
        return entry != null && entry.expiresAt.isAfter(clock.instant());
    }

    private record Entry(Object value, Instant expiresAt) {
    }
}
