package com.flagship.bookstore.domain.book;

import com.flagship.bookstore.domain.Aggregate;
import com.flagship.bookstore.domain.AggregateType;
import com.flagship.bookstore.domain.DomainConflictException;
import com.flagship.bookstore.domain.DomainEvent;
import com.flagship.bookstore.domain.DomainValidationException;
import com.flagship.bookstore.domain.EntityNotFoundException;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Book aggregate.
 *
 * Rebuilt from the book stream; mutators validate and return the event to append.
 *
 * Rules:
 * - Title is required, at most 500 characters
 * - ISBN is optional but must contain 10 or 13 digits
 * - Deleted books cannot be edited, discounted or deleted again
 * - Sales must not overlap and need 0 &lt; percentage &lt; 100
 */
@Value
@Builder(toBuilder = true)
public class Book implements Aggregate<Book> {

    public static final AggregateType<Book> TYPE = new AggregateType<>("Book", Book::empty);

    private static final int MAX_TITLE_LENGTH = 500;
    private static final int MAX_DESCRIPTION_LENGTH = 5000;
    private static final int MAX_COVER_URL_LENGTH = 2000;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    UUID id;
    long version;
    BookDetails details;
    String coverImageUrl;
    List<BookSale> sales;
    boolean deleted;

    static Book empty(UUID id) {
        return new Book(id, 0, null, null, List.of(), false);
    }

    /**
     * Validates the details of a new book.
     *
     * @param today the current date, the latest allowed publication date
     * @return BookAdded event for the new stream
     * @throws DomainValidationException if the details break a rule
     */
    public static BookAdded create(UUID id, BookDetails details, LocalDate today) {
        validate(details, today);
        return new BookAdded(id, details);
    }

    public BookUpdated update(BookDetails newDetails, LocalDate today) {
        if (deleted) {
            throw new DomainConflictException("Cannot update a deleted book");
        }
        validate(newDetails, today);
        return new BookUpdated(id, newDetails);
    }

    public BookSoftDeleted softDelete(Instant timestamp) {
        if (deleted) {
            throw new DomainConflictException("Book is already deleted");
        }
        return new BookSoftDeleted(id, timestamp);
    }

    public BookRestored restore(Instant timestamp) {
        if (!deleted) {
            throw new DomainConflictException("Book is not deleted");
        }
        return new BookRestored(id, timestamp);
    }

    public BookCoverUpdated updateCover(String url) {
        if (deleted) {
            throw new DomainConflictException("Cannot change the cover of a deleted book");
        }
        if (url == null || url.isBlank()) {
            throw new DomainValidationException("Cover image URL is required");
        }
        if (url.length() > MAX_COVER_URL_LENGTH) {
            throw new DomainValidationException("Cover image URL cannot exceed " + MAX_COVER_URL_LENGTH + " characters");
        }
        return new BookCoverUpdated(id, url);
    }

    /**
     * Schedules a discount window.
     *
     * @throws DomainValidationException if percentage or window is invalid
     * @throws DomainConflictException if the window overlaps an existing sale
     */
    public BookSaleScheduled scheduleSale(BigDecimal percentage, Instant start, Instant end) {
        if (deleted) {
            throw new DomainConflictException("Cannot schedule a sale for a deleted book");
        }
        if (percentage == null || percentage.signum() <= 0 || percentage.compareTo(HUNDRED) >= 0) {
            throw new DomainValidationException("Sale percentage must be greater than 0 and less than 100");
        }
        if (start == null || end == null || !start.isBefore(end)) {
            throw new DomainValidationException("Sale start time must be before end time");
        }
        boolean overlapping = sales.stream().anyMatch(s -> s.overlaps(start, end));
        if (overlapping) {
            throw new DomainConflictException("Sale period overlaps with an existing sale");
        }
        return new BookSaleScheduled(id, new BookSale(percentage, start, end));
    }

    public BookSaleCancelled cancelSale(Instant saleStart) {
        boolean exists = sales.stream().anyMatch(s -> s.getStart().equals(saleStart));
        if (!exists) {
            throw new EntityNotFoundException("No sale found starting at " + saleStart);
        }
        return new BookSaleCancelled(id, saleStart);
    }

    @Override
    public Book apply(DomainEvent event, long version) {
        if (event instanceof BookAdded added) {
            return toBuilder().id(added.getBookId()).details(added.getDetails())
                    .deleted(false).version(version).build();
        }
        if (event instanceof BookUpdated updated) {
            return toBuilder().details(updated.getDetails()).version(version).build();
        }
        if (event instanceof BookSoftDeleted) {
            return toBuilder().deleted(true).version(version).build();
        }
        if (event instanceof BookRestored) {
            return toBuilder().deleted(false).version(version).build();
        }
        if (event instanceof BookCoverUpdated cover) {
            return toBuilder().coverImageUrl(cover.getCoverImageUrl()).version(version).build();
        }
        if (event instanceof BookSaleScheduled scheduled) {
            List<BookSale> next = new ArrayList<>(sales);
            next.removeIf(s -> s.getStart().equals(scheduled.getSale().getStart()));
            next.add(scheduled.getSale());
            return toBuilder().sales(List.copyOf(next)).version(version).build();
        }
        if (event instanceof BookSaleCancelled cancelled) {
            List<BookSale> next = new ArrayList<>(sales);
            next.removeIf(s -> s.getStart().equals(cancelled.getSaleStart()));
            return toBuilder().sales(List.copyOf(next)).version(version).build();
        }
        throw new IllegalArgumentException("Event " + event.getEventType() + " does not apply to Book");
    }

    static void validate(BookDetails details, LocalDate today) {
        if (details == null) {
            throw new DomainValidationException("Book details are required");
        }
        String title = details.getTitle();
        if (title == null || title.isBlank()) {
            throw new DomainValidationException("Title is required");
        }
        if (title.length() > MAX_TITLE_LENGTH) {
            throw new DomainValidationException("Title cannot exceed " + MAX_TITLE_LENGTH + " characters");
        }
        validateIsbn(details.getIsbn());
        if (details.getLanguage() == null || details.getLanguage().isBlank()) {
            throw new DomainValidationException("Language is required");
        }
        for (Map.Entry<String, String> description : details.getDescriptions().entrySet()) {
            if (description.getValue() != null && description.getValue().length() > MAX_DESCRIPTION_LENGTH) {
                throw new DomainValidationException(String.format(
                        "Description for '%s' cannot exceed %d characters", description.getKey(), MAX_DESCRIPTION_LENGTH));
            }
        }
        LocalDate publicationDate = details.getPublicationDate();
        if (publicationDate != null && publicationDate.isAfter(today)) {
            throw new DomainValidationException("Publication date cannot be in the future");
        }
        for (Map.Entry<String, BigDecimal> price : details.getPrices().entrySet()) {
            if (price.getKey() == null || !price.getKey().matches("[A-Z]{3}")) {
                throw new DomainValidationException("Invalid currency code: " + price.getKey());
            }
            if (price.getValue() == null || price.getValue().signum() < 0) {
                throw new DomainValidationException("Price for " + price.getKey() + " cannot be negative");
            }
        }
    }

    private static void validateIsbn(String isbn) {
        if (isbn == null || isbn.isBlank()) {
            return;
        }
        long digits = isbn.chars().filter(Character::isDigit).count();
        if (digits != 10 && digits != 13) {
            throw new DomainValidationException("ISBN must be 10 or 13 digits");
        }
    }
}
