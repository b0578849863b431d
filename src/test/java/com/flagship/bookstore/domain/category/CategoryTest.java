package com.flagship.bookstore.domain.category;

import com.flagship.bookstore.domain.DomainValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class CategoryTest {

    private final UUID categoryId = UUID.randomUUID();

    @Test
    @DisplayName("A category needs at least one non-blank localized name")
    void requiresLocalizedName() {
        assertThrows(DomainValidationException.class, () -> Category.create(categoryId, Map.of()));
        assertThrows(DomainValidationException.class, () -> Category.create(categoryId, Map.of("en", " ")));

        CategoryAdded added = Category.create(categoryId, Map.of("en", "Fantasy", "de", "Fantasy"));
        Category category = Category.TYPE.initial(categoryId).apply(added, 1);
        assertEquals(1, category.getVersion());
    }
}
