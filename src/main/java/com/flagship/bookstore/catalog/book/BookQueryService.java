package com.flagship.bookstore.catalog.book;

import com.fasterxml.jackson.core.type.TypeReference;
import com.flagship.bookstore.cache.EntityKind;
import com.flagship.bookstore.cache.TaggedCache;
import com.flagship.bookstore.catalog.CacheSettings;
import com.flagship.bookstore.catalog.DocumentQueryService;
import com.flagship.bookstore.catalog.ListQuery;
import com.flagship.bookstore.catalog.PagedResponse;
import com.flagship.bookstore.catalog.book.dto.BookResponse;
import com.flagship.bookstore.domain.book.BookSale;
import com.flagship.bookstore.projection.ProjectionStore;
import com.flagship.bookstore.projection.catalog.BookSearchDocument;
import com.flagship.bookstore.projection.catalog.BookStatisticsDocument;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Predicate;

@Service
public class BookQueryService extends DocumentQueryService<BookSearchDocument, BookResponse> {

    public static final String AUTHOR_FILTER = "authorId";
    public static final String CATEGORY_FILTER = "categoryId";
    public static final String PUBLISHER_FILTER = "publisherId";

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final Clock clock;

    public BookQueryService(ProjectionStore store, TaggedCache cache, CacheSettings settings, Clock clock) {
        super(store, cache, settings);
        this.clock = clock;
    }

    @Override
    protected EntityKind entityKind() {
        return EntityKind.BOOK;
    }

    @Override
    protected Class<BookSearchDocument> documentType() {
        return BookSearchDocument.class;
    }

    @Override
    protected TypeReference<BookResponse> responseType() {
        return new TypeReference<>() {
        };
    }

    @Override
    protected TypeReference<PagedResponse<BookResponse>> pageType() {
        return new TypeReference<>() {
        };
    }

    @Override
    protected BookResponse toResponse(BookSearchDocument document) {
        BookStatisticsDocument statistics = store
                .find(BookStatisticsDocument.class, BookStatisticsDocument.idFor(document.getId()))
                .orElse(null);
        return BookResponse.from(document, statistics);
    }

    @Override
    protected boolean matchesSearch(BookSearchDocument document, String term) {
        return contains(document.getSearchText(), term);
    }

    @Override
    protected boolean matchesFilters(BookSearchDocument document, ListQuery query) {
        return matchesId(query.filter(AUTHOR_FILTER), id -> document.getAuthorIds().contains(id))
                && matchesId(query.filter(CATEGORY_FILTER), id -> document.getCategoryIds().contains(id))
                && matchesId(query.filter(PUBLISHER_FILTER), id -> id.equals(document.getPublisherId()));
    }

    @Override
    protected Map<String, Comparator<BookSearchDocument>> sortOrders() {
        Map<String, Comparator<BookSearchDocument>> orders = new LinkedHashMap<>();
        orders.put("title", Comparator.comparing(BookSearchDocument::getTitle,
                Comparator.nullsLast(String.CASE_INSENSITIVE_ORDER)).thenComparing(BookSearchDocument::getId));
        orders.put("publicationDate", Comparator.comparing(BookSearchDocument::getPublicationDate,
                Comparator.nullsLast(Comparator.<LocalDate>naturalOrder())).thenComparing(BookSearchDocument::getId));
        orders.put("lastModified", Comparator.comparing(BookSearchDocument::getLastModified)
                .thenComparing(BookSearchDocument::getId));
        return orders;
    }

    /**
     * Applies the sale active at read time to every list price.
     */
    @Override
    protected BookResponse atReadTime(BookResponse response) {
        Instant now = clock.instant();
        Optional<BookSale> activeSale = response.getSales() == null ? Optional.empty()
                : response.getSales().stream().filter(sale -> sale.isActiveAt(now)).findFirst();

        Map<String, BigDecimal> currentPrices = new LinkedHashMap<>();
        if (response.getPrices() != null) {
            response.getPrices().forEach((currency, price) -> currentPrices.put(currency,
                    activeSale.map(sale -> discounted(price, sale.getPercentage())).orElse(price)));
        }
        return response.toBuilder().currentPrices(currentPrices).build();
    }

    static BigDecimal discounted(BigDecimal price, BigDecimal percentage) {
        return price.multiply(HUNDRED.subtract(percentage))
                .divide(HUNDRED, 2, RoundingMode.HALF_UP);
    }

    private static boolean matchesId(String filter, Predicate<UUID> test) {
        return filter == null || test.test(UUID.fromString(filter));
    }
}
