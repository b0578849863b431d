package com.flagship.bookstore.domain.author;

import com.flagship.bookstore.domain.DomainConflictException;
import com.flagship.bookstore.domain.DomainValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class AuthorTest {

    private final UUID authorId = UUID.randomUUID();

    @Test
    @DisplayName("Author name is required and biographies must not contain null entries")
    void validatesNameAndBiographies() {
        assertThrows(DomainValidationException.class, () -> Author.create(authorId, "", Map.of()));

        Map<String, String> biographies = new HashMap<>();
        biographies.put("en", null);
        assertThrows(DomainValidationException.class, () -> Author.create(authorId, "Ursula K. Le Guin", biographies));
    }

    @Test
    @DisplayName("Soft delete and restore toggle the deleted flag once each")
    void softDeleteAndRestore() {
        Author author = Author.TYPE.initial(authorId)
                .apply(Author.create(authorId, "Ursula K. Le Guin", Map.of("en", "Author of Earthsea")), 1);
        Instant now = Instant.parse("2026-01-01T00:00:00Z");

        Author deleted = author.apply(author.softDelete(now), 2);
        assertTrue(deleted.isDeleted());
        assertThrows(DomainConflictException.class, () -> deleted.softDelete(now));
        assertThrows(DomainConflictException.class, () -> deleted.update("New name", Map.of()));

        Author restored = deleted.apply(deleted.restore(now), 3);
        assertFalse(restored.isDeleted());
        assertEquals(3, restored.getVersion());
    }
}
