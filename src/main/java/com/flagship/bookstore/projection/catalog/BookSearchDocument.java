package com.flagship.bookstore.projection.catalog;

import com.flagship.bookstore.domain.book.BookSale;
import com.flagship.bookstore.projection.ProjectionDocument;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Search-optimized book document.
 *
 * Publisher and author names are copied in when the book event is folded, so list
 * queries never join. {@code searchText} concatenates title, ISBN, publisher and authors.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class BookSearchDocument implements ProjectionDocument {
    UUID id;
    long version;
    boolean deleted;
    Instant deletedAt;
    Instant lastModified;

    String title;
    String isbn;
    String language;
    Map<String, String> descriptions;
    LocalDate publicationDate;
    UUID publisherId;
    String publisherName;
    List<UUID> authorIds;
    String authorNames;
    List<UUID> categoryIds;
    Map<String, BigDecimal> prices;
    List<BookSale> sales;
    String coverImageUrl;
    String searchText;
}
