package com.flagship.bookstore.projection.catalog;

import com.flagship.bookstore.domain.book.BookAdded;
import com.flagship.bookstore.domain.book.BookDetails;
import com.flagship.bookstore.domain.book.BookUpdated;
import com.flagship.bookstore.eventstore.StoredEvent;
import com.flagship.bookstore.projection.InMemoryProjectionStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class PublisherStatisticsProjectionTest {

    private static final Instant T0 = Instant.parse("2026-04-01T08:00:00Z");

    private final PublisherStatisticsProjection projection = new PublisherStatisticsProjection();
    private final InMemoryProjectionStore store = new InMemoryProjectionStore();
    private final UUID bookId = UUID.randomUUID();
    private final UUID orbit = UUID.randomUUID();
    private final UUID tor = UUID.randomUUID();

    private BookDetails publishedBy(UUID publisherId) {
        return BookDetails.builder().title("Ancillary Justice").language("en").publisherId(publisherId).build();
    }

    @Test
    @DisplayName("A book without a publisher is routed nowhere")
    void bookWithoutPublisherIsIgnored() {
        StoredEvent added = new StoredEvent(UUID.randomUUID(), bookId, "Book", 1, 1,
                new BookAdded(bookId, publishedBy(null)), T0);

        assertTrue(projection.identify(added, store).isEmpty());
    }

    @Test
    @DisplayName("Switching publisher routes the update to both publishers")
    void publisherSwitchRoutesToBoth() {
        StoredEvent added = new StoredEvent(UUID.randomUUID(), bookId, "Book", 1, 1,
                new BookAdded(bookId, publishedBy(orbit)), T0);
        PublisherStatisticsDocument orbitStats = projection.fold(orbit, null, added, store);
        store.save(BookSearchDocument.builder().id(bookId).version(1).title("Ancillary Justice")
                .publisherId(orbit).build());

        StoredEvent updated = new StoredEvent(UUID.randomUUID(), bookId, "Book", 2, 2,
                new BookUpdated(bookId, publishedBy(tor)), T0);

        assertEquals(Set.of(orbit, tor), projection.identify(updated, store));
        assertEquals(0, projection.fold(orbit, orbitStats, updated, store).getBookCount());
        assertEquals(1, projection.fold(tor, null, updated, store).getBookCount());
    }
}
