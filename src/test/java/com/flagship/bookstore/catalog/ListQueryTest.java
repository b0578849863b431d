package com.flagship.bookstore.catalog;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class ListQueryTest {

    private Locale defaultLocale;

    @BeforeEach
    void setUp() {
        defaultLocale = Locale.getDefault();
    }

    @AfterEach
    void tearDown() {
        Locale.setDefault(defaultLocale);
    }

    @Test
    @DisplayName("The search term in the cache key does not depend on the default locale")
    void searchKeyIgnoresDefaultLocale() {
        ListQuery query = ListQuery.builder().page(0).size(20).search(" TITLE ").build();

        Locale.setDefault(Locale.forLanguageTag("tr-TR"));

        assertEquals("title", query.cacheParameters().get("search"));
    }

    @Test
    @DisplayName("Queries differing only in search case share a cache key")
    void searchCaseSharesKey() {
        ListQuery upper = ListQuery.builder().page(1).size(10).search("EARTHSEA").build();
        ListQuery lower = ListQuery.builder().page(1).size(10).search("earthsea").build();

        assertEquals(upper.cacheParameters(), lower.cacheParameters());
    }

    @Test
    @DisplayName("Negative pages and out-of-range sizes are rejected")
    void validateRejectsOutOfRange() {
        assertThrows(IllegalArgumentException.class, () -> ListQuery.builder().page(-1).size(10).build().validate());
        assertThrows(IllegalArgumentException.class, () -> ListQuery.builder().page(0).size(0).build().validate());
        assertThrows(IllegalArgumentException.class,
                () -> ListQuery.builder().page(0).size(ListQuery.MAX_PAGE_SIZE + 1).build().validate());
        assertDoesNotThrow(() -> ListQuery.builder().page(Integer.MAX_VALUE).size(100).build().validate());
    }
}
