package com.flagship.bookstore.invalidation;

import com.flagship.bookstore.cache.EntityKind;
import com.flagship.bookstore.cache.TaggedCache;
import com.flagship.bookstore.notification.NotificationPublisher;
import com.flagship.bookstore.observability.PipelineMetrics;
import com.flagship.bookstore.projection.ProjectionDocument;
import com.flagship.bookstore.projection.ProjectionStore;
import com.flagship.bookstore.projection.catalog.BookSearchDocument;
import com.flagship.bookstore.projection.catalog.BookStatisticsDocument;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.UUID;

@Component
public class BookStatisticsInvalidationHandler extends StatisticsInvalidationHandler<BookStatisticsDocument> {

    public BookStatisticsInvalidationHandler(TaggedCache cache, NotificationPublisher publisher,
                                             PipelineMetrics metrics, Clock clock, ProjectionStore store) {
        super(cache, publisher, metrics, clock, store);
    }

    @Override
    public Class<BookStatisticsDocument> documentType() {
        return BookStatisticsDocument.class;
    }

    @Override
    protected Class<? extends ProjectionDocument> parentType() {
        return BookSearchDocument.class;
    }

    @Override
    protected EntityKind entityKind() {
        return EntityKind.BOOK;
    }

    @Override
    protected UUID entityId(BookStatisticsDocument document) {
        return document.getBookId();
    }
}
