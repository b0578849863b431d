package com.flagship.bookstore.domain.book;

import com.flagship.bookstore.domain.DomainConflictException;
import com.flagship.bookstore.domain.DomainValidationException;
import com.flagship.bookstore.domain.EntityNotFoundException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class BookTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final LocalDate TODAY = LocalDate.parse("2026-03-01");

    private final UUID bookId = UUID.randomUUID();

    private BookDetails details(String title) {
        return BookDetails.builder()
                .title(title)
                .isbn("978-0-13-468599-1")
                .language("en")
                .price("USD", new BigDecimal("39.99"))
                .build();
    }

    private Book added() {
        BookAdded event = Book.create(bookId, details("Effective Java"), TODAY);
        return Book.TYPE.initial(bookId).apply(event, 1);
    }

    @Test
    @DisplayName("Creating a book validates the details and yields BookAdded")
    void createYieldsBookAdded() {
        BookAdded event = Book.create(bookId, details("Effective Java"), TODAY);

        assertEquals(bookId, event.getBookId());
        assertEquals("Effective Java", event.getDetails().getTitle());
        assertEquals(BookAdded.EVENT_TYPE, event.getEventType());
    }

    @Test
    @DisplayName("Blank title, bad ISBN and future publication date are rejected")
    void invalidDetailsAreRejected() {
        assertThrows(DomainValidationException.class, () -> Book.create(bookId, details(" "), TODAY));
        assertThrows(DomainValidationException.class, () -> Book.create(bookId, details("x".repeat(501)), TODAY));
        assertThrows(DomainValidationException.class, () -> Book.create(bookId,
                details("Title").toBuilder().isbn("12345").build(), TODAY));
        assertThrows(DomainValidationException.class, () -> Book.create(bookId,
                details("Title").toBuilder().publicationDate(TODAY.plusDays(1)).build(), TODAY));
        assertThrows(DomainValidationException.class, () -> Book.create(bookId,
                details("Title").toBuilder().price("usd", BigDecimal.ONE).build(), TODAY));
    }

    @Test
    @DisplayName("The publication date is checked against the supplied date, not the system date")
    void publicationDateUsesSuppliedDate() {
        LocalDate futureForReader = LocalDate.parse("2031-05-20");
        BookDetails onSale = details("Title").toBuilder().publicationDate(futureForReader).build();

        assertDoesNotThrow(() -> Book.create(bookId, onSale, futureForReader));
        assertDoesNotThrow(() -> added().update(onSale, futureForReader));
        assertThrows(DomainValidationException.class, () -> Book.create(bookId, onSale, TODAY));
        assertThrows(DomainValidationException.class, () -> added().update(onSale, TODAY));
    }

    @Test
    @DisplayName("Applying events tracks version and deletion state")
    void applyTracksVersionAndDeletion() {
        Book book = added();
        assertEquals(1, book.getVersion());
        assertFalse(book.isDeleted());

        Book deleted = book.apply(book.softDelete(NOW), 2);
        assertEquals(2, deleted.getVersion());
        assertTrue(deleted.isDeleted());

        Book restored = deleted.apply(deleted.restore(NOW), 3);
        assertEquals(3, restored.getVersion());
        assertFalse(restored.isDeleted());
    }

    @Test
    @DisplayName("Deleted books reject updates, covers, sales and a second delete")
    void deletedBookRejectsMutations() {
        Book deleted = added().apply(new BookSoftDeleted(bookId, NOW), 2);

        assertThrows(DomainConflictException.class, () -> deleted.update(details("New"), TODAY));
        assertThrows(DomainConflictException.class, () -> deleted.updateCover("https://covers/1.png"));
        assertThrows(DomainConflictException.class,
                () -> deleted.scheduleSale(BigDecimal.TEN, NOW, NOW.plusSeconds(3600)));
        assertThrows(DomainConflictException.class, () -> deleted.softDelete(NOW));
    }

    @Test
    @DisplayName("Restoring a live book is a conflict")
    void restoringLiveBookConflicts() {
        assertThrows(DomainConflictException.class, () -> added().restore(NOW));
    }

    @Test
    @DisplayName("Sales must have a valid percentage and window and must not overlap")
    void salesAreValidated() {
        Book book = added();
        Instant end = NOW.plusSeconds(86400);

        assertThrows(DomainValidationException.class, () -> book.scheduleSale(BigDecimal.ZERO, NOW, end));
        assertThrows(DomainValidationException.class, () -> book.scheduleSale(new BigDecimal("100"), NOW, end));
        assertThrows(DomainValidationException.class, () -> book.scheduleSale(BigDecimal.TEN, end, NOW));

        Book withSale = book.apply(book.scheduleSale(BigDecimal.TEN, NOW, end), 2);
        assertEquals(1, withSale.getSales().size());

        assertThrows(DomainConflictException.class,
                () -> withSale.scheduleSale(BigDecimal.ONE, NOW.plusSeconds(3600), end.plusSeconds(3600)));
        assertDoesNotThrow(() -> withSale.scheduleSale(BigDecimal.ONE, end, end.plusSeconds(3600)));
    }

    @Test
    @DisplayName("Cancelling a sale needs a sale with that start")
    void cancelSaleRequiresExistingSale() {
        Book book = added();
        Book withSale = book.apply(book.scheduleSale(BigDecimal.TEN, NOW, NOW.plusSeconds(60)), 2);

        assertThrows(EntityNotFoundException.class, () -> withSale.cancelSale(NOW.plusSeconds(1)));

        Book cancelled = withSale.apply(withSale.cancelSale(NOW), 3);
        assertTrue(cancelled.getSales().isEmpty());
    }
}
