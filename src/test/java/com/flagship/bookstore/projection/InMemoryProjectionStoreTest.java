package com.flagship.bookstore.projection;

import com.flagship.bookstore.projection.catalog.AuthorDocument;
import com.flagship.bookstore.projection.catalog.AuthorStatisticsDocument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.domain.Page;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryProjectionStoreTest {

    private InMemoryProjectionStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryProjectionStore();
        for (String name : List.of("Le Guin", "Leckie", "Clarke")) {
            store.save(AuthorDocument.builder().id(UUID.randomUUID()).version(1).name(name).build());
        }
    }

    private Page<AuthorDocument> page(int page, int size) {
        return store.query(AuthorDocument.class, d -> true, Comparator.comparing(AuthorDocument::getName), page, size);
    }

    @Test
    @DisplayName("Queries filter, sort and page over all documents of a type")
    void queryPages() {
        Page<AuthorDocument> first = page(0, 2);

        assertEquals(List.of("Clarke", "Le Guin"), first.getContent().stream().map(AuthorDocument::getName).toList());
        assertEquals(3, first.getTotalElements());
        assertEquals(2, first.getTotalPages());
        assertEquals(List.of("Leckie"), page(1, 2).getContent().stream().map(AuthorDocument::getName).toList());
    }

    @Test
    @DisplayName("A page whose offset exceeds the int range is empty")
    void farPageIsEmpty() {
        Page<AuthorDocument> far = assertDoesNotThrow(() -> page(21_474_837, 100));

        assertTrue(far.getContent().isEmpty());
        assertEquals(3, far.getTotalElements());
        assertTrue(page(Integer.MAX_VALUE, 100).getContent().isEmpty());
    }

    @Test
    @DisplayName("Documents of different types may share an id")
    void typesAreSeparate() {
        UUID authorId = UUID.randomUUID();
        store.save(AuthorDocument.builder().id(authorId).version(4).name("Jemisin").build());
        store.save(AuthorStatisticsDocument.builder().id(authorId).version(1).bookCount(0)
                .bookVersions(Map.of()).bookIds(Set.of()).build());

        assertEquals(4, store.find(AuthorDocument.class, authorId).orElseThrow().getVersion());
        assertEquals(1, store.find(AuthorStatisticsDocument.class, authorId).orElseThrow().getVersion());
    }

    @Test
    @DisplayName("The checkpoint starts at zero and survives a document clear")
    void checkpoint() {
        assertEquals(0, store.checkpoint());

        store.saveCheckpoint(12);
        store.clear();

        assertEquals(12, store.checkpoint());
        assertTrue(store.findAll(AuthorDocument.class).isEmpty());
    }
}
