package com.flagship.bookstore.cache;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class CacheKeyTest {

    @Test
    @DisplayName("Item keys and tags share the entity prefix")
    void itemKeyAndTag() {
        UUID id = UUID.fromString("3f2c1a52-0a4e-4f5c-9a43-2d7a0b6c1e11");

        assertEquals("book:3f2c1a52-0a4e-4f5c-9a43-2d7a0b6c1e11", CacheKey.item(EntityKind.BOOK, id).getValue());
        assertEquals("book:3f2c1a52-0a4e-4f5c-9a43-2d7a0b6c1e11", CacheTag.item(EntityKind.BOOK, id).getValue());
        assertEquals("categoriesList", CacheTag.collection(EntityKind.CATEGORY).getValue());
    }

    @Test
    @DisplayName("Collection keys do not depend on parameter order and write null as empty")
    void collectionKeyIsDeterministic() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("size", 20);
        first.put("page", 0);
        first.put("search", null);
        Map<String, Object> second = new HashMap<>();
        second.put("search", null);
        second.put("page", 0);
        second.put("size", 20);

        CacheKey key = CacheKey.collection(EntityKind.AUTHOR, first);

        assertEquals("authorsList:page=0;search=;size=20", key.getValue());
        assertEquals(key, CacheKey.collection(EntityKind.AUTHOR, second));
    }
}
