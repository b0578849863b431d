package com.flagship.bookstore.invalidation;

import com.flagship.bookstore.cache.EntityKind;
import com.flagship.bookstore.cache.TaggedCache;
import com.flagship.bookstore.notification.NotificationPublisher;
import com.flagship.bookstore.observability.PipelineMetrics;
import com.flagship.bookstore.projection.ProjectionStore;
import com.flagship.bookstore.projection.catalog.BookSearchDocument;
import com.flagship.bookstore.projection.catalog.BookStatisticsDocument;
import org.springframework.stereotype.Component;

import java.time.Clock;

@Component
public class BookInvalidationHandler extends EntityInvalidationHandler<BookSearchDocument> {

    private final ProjectionStore store;

    public BookInvalidationHandler(TaggedCache cache, NotificationPublisher publisher, PipelineMetrics metrics,
                                   Clock clock, ProjectionStore store) {
        super(cache, publisher, metrics, clock);
        this.store = store;
    }

    @Override
    public Class<BookSearchDocument> documentType() {
        return BookSearchDocument.class;
    }

    @Override
    protected EntityKind entityKind() {
        return EntityKind.BOOK;
    }

    @Override
    protected String displayName(BookSearchDocument document) {
        return document.getTitle();
    }

    @Override
    protected long statisticsVersion(BookSearchDocument document) {
        return versionOf(store, BookStatisticsDocument.class, BookStatisticsDocument.idFor(document.getId()));
    }
}
