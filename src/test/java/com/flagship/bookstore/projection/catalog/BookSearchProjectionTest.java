package com.flagship.bookstore.projection.catalog;

import com.flagship.bookstore.domain.DomainEvent;
import com.flagship.bookstore.domain.book.BookAdded;
import com.flagship.bookstore.domain.book.BookDetails;
import com.flagship.bookstore.domain.book.BookSale;
import com.flagship.bookstore.domain.book.BookSaleScheduled;
import com.flagship.bookstore.domain.book.BookSoftDeleted;
import com.flagship.bookstore.domain.book.BookUpdated;
import com.flagship.bookstore.eventstore.StoredEvent;
import com.flagship.bookstore.projection.InMemoryProjectionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class BookSearchProjectionTest {

    private static final Instant T0 = Instant.parse("2026-04-01T08:00:00Z");

    private final BookSearchProjection projection = new BookSearchProjection();
    private final UUID bookId = UUID.randomUUID();
    private final UUID publisherId = UUID.randomUUID();
    private final UUID authorId = UUID.randomUUID();
    private final UUID missingAuthorId = UUID.randomUUID();

    private InMemoryProjectionStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryProjectionStore();
        store.save(PublisherDocument.builder().id(publisherId).version(1).name("Orbit").build());
        store.save(AuthorDocument.builder().id(authorId).version(1).name("Ann Leckie").build());
    }

    private StoredEvent event(long version, DomainEvent data) {
        return new StoredEvent(UUID.randomUUID(), bookId, "Book", version, version, data, T0.plusSeconds(version));
    }

    private BookDetails details(String title) {
        return BookDetails.builder()
                .title(title)
                .isbn("9780316246620")
                .language("en")
                .publisherId(publisherId)
                .authorId(authorId)
                .authorId(missingAuthorId)
                .price("USD", new BigDecimal("17.99"))
                .build();
    }

    @Test
    @DisplayName("BookAdded creates the document with denormalized names, skipping unprojected authors")
    void bookAddedCreatesDocument() {
        BookSearchDocument document = projection.fold(bookId, null,
                event(1, new BookAdded(bookId, details("Ancillary Justice"))), store);

        assertEquals(bookId, document.getId());
        assertEquals(1, document.getVersion());
        assertEquals("Orbit", document.getPublisherName());
        assertEquals("Ann Leckie", document.getAuthorNames());
        assertEquals("Ancillary Justice 9780316246620 Orbit Ann Leckie", document.getSearchText());
        assertFalse(document.isDeleted());
        assertTrue(document.getSales().isEmpty());
    }

    @Test
    @DisplayName("Folding an event the document already reflects leaves it unchanged")
    void replayedEventIsSkipped() {
        StoredEvent added = event(1, new BookAdded(bookId, details("Ancillary Justice")));
        StoredEvent updated = event(2, new BookUpdated(bookId, details("Ancillary Sword")));

        BookSearchDocument once = projection.fold(bookId, projection.fold(bookId, null, added, store), updated, store);
        BookSearchDocument replayed = projection.fold(bookId, projection.fold(bookId, once, added, store), updated, store);

        assertSame(once, replayed);
        assertEquals("Ancillary Sword", replayed.getTitle());
        assertEquals(2, replayed.getVersion());
    }

    @Test
    @DisplayName("An event beyond the next version fails the fold")
    void versionGapFails() {
        BookSearchDocument document = projection.fold(bookId, null,
                event(1, new BookAdded(bookId, details("Ancillary Justice"))), store);

        assertThrows(IllegalStateException.class,
                () -> projection.fold(bookId, document, event(3, new BookSoftDeleted(bookId, T0)), store));
    }

    @Test
    @DisplayName("Soft delete keeps the document and marks it deleted")
    void softDeleteMarksDocument() {
        BookSearchDocument document = projection.fold(bookId, null,
                event(1, new BookAdded(bookId, details("Ancillary Justice"))), store);
        BookSearchDocument deleted = projection.fold(bookId, document, event(2, new BookSoftDeleted(bookId, T0)), store);

        assertTrue(deleted.isDeleted());
        assertEquals(T0, deleted.getDeletedAt());
        assertEquals(2, deleted.getVersion());
    }

    @Test
    @DisplayName("Scheduled sales are kept ordered by start")
    void salesAreOrdered() {
        BookSearchDocument document = projection.fold(bookId, null,
                event(1, new BookAdded(bookId, details("Ancillary Justice"))), store);
        BookSale later = new BookSale(BigDecimal.TEN, T0.plusSeconds(7200), T0.plusSeconds(10800));
        BookSale earlier = new BookSale(BigDecimal.ONE, T0, T0.plusSeconds(3600));

        document = projection.fold(bookId, document, event(2, new BookSaleScheduled(bookId, later)), store);
        document = projection.fold(bookId, document, event(3, new BookSaleScheduled(bookId, earlier)), store);

        assertEquals(2, document.getSales().size());
        assertEquals(earlier, document.getSales().get(0));
    }

    @Test
    @DisplayName("Events of other streams are not identified")
    void ignoresOtherStreams() {
        StoredEvent foreign = new StoredEvent(UUID.randomUUID(), UUID.randomUUID(), "Author", 1, 1,
                new BookSoftDeleted(bookId, T0), T0);

        assertTrue(projection.identify(foreign, store).isEmpty());
    }
}
