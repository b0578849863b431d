package com.flagship.bookstore.domain.book;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * The editable part of a book, carried by BookAdded and BookUpdated.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class BookDetails {
    String title;
    String isbn;
    String language;
    @Singular(ignoreNullCollections = true)
    Map<String, String> descriptions;
    LocalDate publicationDate;
    UUID publisherId;
    @Singular(ignoreNullCollections = true)
    List<UUID> authorIds;
    @Singular(ignoreNullCollections = true)
    List<UUID> categoryIds;
    @Singular(ignoreNullCollections = true)
    Map<String, BigDecimal> prices;
}
