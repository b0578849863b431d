package com.flagship.bookstore.catalog.book.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bookstore.domain.book.BookDetails;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Request body for adding or updating a book.
 *
 * Only shape is checked here; the book aggregate enforces the business rules.
 */
@Value
public class BookRequest {

    @NotBlank(message = "Title is required")
    @Size(max = 500, message = "Title cannot exceed 500 characters")
    @JsonProperty("title")
    String title;

    @JsonProperty("isbn")
    String isbn;

    @NotBlank(message = "Language is required")
    @JsonProperty("language")
    String language;

    @JsonProperty("descriptions")
    Map<String, String> descriptions;

    @JsonProperty("publication_date")
    LocalDate publicationDate;

    @JsonProperty("publisher_id")
    UUID publisherId;

    @JsonProperty("author_ids")
    List<UUID> authorIds;

    @JsonProperty("category_ids")
    List<UUID> categoryIds;

    @JsonProperty("prices")
    Map<String, BigDecimal> prices;

    public BookDetails toDetails() {
        return BookDetails.builder()
                .title(title)
                .isbn(isbn)
                .language(language)
                .descriptions(descriptions)
                .publicationDate(publicationDate)
                .publisherId(publisherId)
                .authorIds(authorIds)
                .categoryIds(categoryIds)
                .prices(prices)
                .build();
    }
}
