package com.flagship.bookstore.catalog.book.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bookstore.catalog.VersionedResponse;
import com.flagship.bookstore.domain.book.BookSale;
import com.flagship.bookstore.projection.catalog.BookSearchDocument;
import com.flagship.bookstore.projection.catalog.BookStatisticsDocument;
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
 * Book as served to readers.
 *
 * {@code current_prices} depends on the time of the read and is filled in after the
 * cache lookup; every other field is cached.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class BookResponse implements VersionedResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("version")
    long version;

    @JsonProperty("deleted")
    boolean deleted;

    @JsonProperty("deleted_at")
    Instant deletedAt;

    @JsonProperty("title")
    String title;

    @JsonProperty("isbn")
    String isbn;

    @JsonProperty("language")
    String language;

    @JsonProperty("descriptions")
    Map<String, String> descriptions;

    @JsonProperty("publication_date")
    LocalDate publicationDate;

    @JsonProperty("publisher_id")
    UUID publisherId;

    @JsonProperty("publisher_name")
    String publisherName;

    @JsonProperty("author_ids")
    List<UUID> authorIds;

    @JsonProperty("author_names")
    String authorNames;

    @JsonProperty("category_ids")
    List<UUID> categoryIds;

    @JsonProperty("prices")
    Map<String, BigDecimal> prices;

    @JsonProperty("current_prices")
    Map<String, BigDecimal> currentPrices;

    @JsonProperty("sales")
    List<BookSale> sales;

    @JsonProperty("cover_image_url")
    String coverImageUrl;

    @JsonProperty("like_count")
    int likeCount;

    @JsonProperty("statistics_version")
    long statisticsVersion;

    @JsonProperty("last_modified")
    Instant lastModified;

    public static BookResponse from(BookSearchDocument document, BookStatisticsDocument statistics) {
        return BookResponse.builder()
                .id(document.getId())
                .version(document.getVersion())
                .deleted(document.isDeleted())
                .deletedAt(document.getDeletedAt())
                .title(document.getTitle())
                .isbn(document.getIsbn())
                .language(document.getLanguage())
                .descriptions(document.getDescriptions())
                .publicationDate(document.getPublicationDate())
                .publisherId(document.getPublisherId())
                .publisherName(document.getPublisherName())
                .authorIds(document.getAuthorIds())
                .authorNames(document.getAuthorNames())
                .categoryIds(document.getCategoryIds())
                .prices(document.getPrices())
                .sales(document.getSales())
                .coverImageUrl(document.getCoverImageUrl())
                .likeCount(statistics == null ? 0 : statistics.getLikeCount())
                .statisticsVersion(statistics == null ? 0 : statistics.getVersion())
                .lastModified(document.getLastModified())
                .build();
    }
}
