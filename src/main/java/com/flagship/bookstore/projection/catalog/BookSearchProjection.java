package com.flagship.bookstore.projection.catalog;

import com.flagship.bookstore.domain.DomainEvent;
import com.flagship.bookstore.domain.book.Book;
import com.flagship.bookstore.domain.book.BookAdded;
import com.flagship.bookstore.domain.book.BookCoverUpdated;
import com.flagship.bookstore.domain.book.BookDetails;
import com.flagship.bookstore.domain.book.BookRestored;
import com.flagship.bookstore.domain.book.BookSale;
import com.flagship.bookstore.domain.book.BookSaleCancelled;
import com.flagship.bookstore.domain.book.BookSaleScheduled;
import com.flagship.bookstore.domain.book.BookSoftDeleted;
import com.flagship.bookstore.domain.book.BookUpdated;
import com.flagship.bookstore.eventstore.StoredEvent;
import com.flagship.bookstore.projection.ProjectionLookup;
import com.flagship.bookstore.projection.SingleStreamProjection;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Builds {@link BookSearchDocument}s from book streams.
 *
 * Related publisher and author names are resolved through the lookup when the book's
 * details change. A related id without a document is skipped: streams are independent,
 * so the referenced entity may not be projected yet.
 */
@Component
public class BookSearchProjection extends SingleStreamProjection<BookSearchDocument> {

    public BookSearchProjection() {
        super(Book.TYPE.getName());
    }

    @Override
    public Class<BookSearchDocument> documentType() {
        return BookSearchDocument.class;
    }

    @Override
    protected BookSearchDocument apply(BookSearchDocument current, StoredEvent event, ProjectionLookup lookup) {
        DomainEvent data = event.getData();
        if (data instanceof BookAdded added) {
            BookSearchDocument.BookSearchDocumentBuilder builder = BookSearchDocument.builder()
                    .id(added.getBookId())
                    .sales(List.of());
            return withDetails(builder, added.getDetails(), event, lookup);
        }

        BookSearchDocument existing = requireExisting(current, event);
        if (data instanceof BookUpdated updated) {
            return withDetails(existing.toBuilder(), updated.getDetails(), event, lookup);
        }

        BookSearchDocument.BookSearchDocumentBuilder next = existing.toBuilder()
                .version(event.getVersion())
                .lastModified(event.getTimestamp());
        if (data instanceof BookSoftDeleted deleted) {
            return next.deleted(true).deletedAt(deleted.getDeletedAt()).build();
        }
        if (data instanceof BookRestored) {
            return next.deleted(false).deletedAt(null).build();
        }
        if (data instanceof BookCoverUpdated cover) {
            return next.coverImageUrl(cover.getCoverImageUrl()).build();
        }
        if (data instanceof BookSaleScheduled scheduled) {
            List<BookSale> sales = new ArrayList<>(existing.getSales());
            sales.removeIf(s -> s.getStart().equals(scheduled.getSale().getStart()));
            sales.add(scheduled.getSale());
            sales.sort(Comparator.comparing(BookSale::getStart));
            return next.sales(List.copyOf(sales)).build();
        }
        if (data instanceof BookSaleCancelled cancelled) {
            List<BookSale> sales = new ArrayList<>(existing.getSales());
            sales.removeIf(s -> s.getStart().equals(cancelled.getSaleStart()));
            return next.sales(List.copyOf(sales)).build();
        }
        throw unsupported(event);
    }

    private BookSearchDocument withDetails(BookSearchDocument.BookSearchDocumentBuilder builder, BookDetails details,
                                           StoredEvent event, ProjectionLookup lookup) {
        String publisherName = Optional.ofNullable(details.getPublisherId())
                .flatMap(id -> lookup.find(PublisherDocument.class, id))
                .map(PublisherDocument::getName)
                .orElse(null);
        String authorNames = details.getAuthorIds().stream()
                .map(id -> lookup.find(AuthorDocument.class, id))
                .flatMap(Optional::stream)
                .map(AuthorDocument::getName)
                .collect(Collectors.joining(", "));

        return builder
                .version(event.getVersion())
                .lastModified(event.getTimestamp())
                .title(details.getTitle())
                .isbn(details.getIsbn())
                .language(details.getLanguage())
                .descriptions(details.getDescriptions())
                .publicationDate(details.getPublicationDate())
                .publisherId(details.getPublisherId())
                .publisherName(publisherName)
                .authorIds(details.getAuthorIds())
                .authorNames(authorNames)
                .categoryIds(details.getCategoryIds())
                .prices(details.getPrices())
                .searchText(searchText(details.getTitle(), details.getIsbn(), publisherName, authorNames))
                .build();
    }

    static String searchText(String... parts) {
        return Stream.of(parts)
                .filter(part -> part != null && !part.isBlank())
                .collect(Collectors.joining(" "))
                .trim();
    }
}
