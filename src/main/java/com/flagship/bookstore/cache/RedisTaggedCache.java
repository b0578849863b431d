package com.flagship.bookstore.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Redis-backed tagged cache.
 *
 * Layout (under the configured prefix):
 * - {@code {prefix}{key}}: JSON value with a TTL
 * - {@code {prefix}tag:{tag}}: set of keys stored with the tag
 *
 * Reads degrade to the factory when Redis is unavailable. Evictions do not:
 * a failed {@link #removeByTag} propagates so the caller can report the stale entry.
 */
@Component
@ConditionalOnProperty(name = "bookstore.cache.type", havingValue = "redis", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class RedisTaggedCache implements TaggedCache {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    @Value("${bookstore.cache.key-prefix:bookstore:}")
    private String keyPrefix;

    @Override
    public <T> T getOrCreate(CacheKey key, TypeReference<T> type, Supplier<T> factory, Set<CacheTag> tags, Duration ttl) {
        String redisKey = keyPrefix + key.getValue();
        try {
            String cached = redisTemplate.opsForValue().get(redisKey);
            if (cached != null) {
                log.debug("Cache hit: key={}", key);
                return objectMapper.readValue(cached, type);
            }
        } catch (Exception e) {
            log.warn("Redis read failed for key {}. Falling back to the query. Error: {}", key, e.getMessage());
        }

        T value = factory.get();
        if (value == null) {
            return null;
        }

        try {
            redisTemplate.opsForValue().set(redisKey, objectMapper.writeValueAsString(value), ttl);
            for (CacheTag tag : tags) {
                String tagKey = tagKey(tag);
                redisTemplate.opsForSet().add(tagKey, key.getValue());
                Long expiresIn = redisTemplate.getExpire(tagKey);
                if (expiresIn == null || expiresIn < ttl.getSeconds()) {
                    redisTemplate.expire(tagKey, ttl);
                }
            }
        } catch (Exception e) {
            log.warn("Failed to cache key {} in Redis. Error: {}", key, e.getMessage());
        }
        return value;
    }

    @Override
    public void removeByTag(CacheTag tag) {
        String tagKey = tagKey(tag);
        Set<String> members = redisTemplate.opsForSet().members(tagKey);
        List<String> keys = new ArrayList<>();
        if (members != null) {
            members.forEach(member -> keys.add(keyPrefix + member));
        }
        keys.add(tagKey);
        Long removed = redisTemplate.delete(keys);
        log.debug("Invalidated tag {}: {} key(s) removed", tag, removed);
    }

    @Override
    public void clear() {
        Set<String> keys = redisTemplate.keys(keyPrefix + "*");
        if (keys != null && !keys.isEmpty()) {
            redisTemplate.delete(keys);
        }
        log.info("Cleared {} Redis key(s) under prefix {}", keys == null ? 0 : keys.size(), keyPrefix);
    }

    private String tagKey(CacheTag tag) {
        return keyPrefix + "tag:" + tag.getValue();
    }
}
