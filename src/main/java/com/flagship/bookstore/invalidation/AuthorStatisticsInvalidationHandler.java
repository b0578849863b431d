package com.flagship.bookstore.invalidation;

import com.flagship.bookstore.cache.EntityKind;
import com.flagship.bookstore.cache.TaggedCache;
import com.flagship.bookstore.notification.NotificationPublisher;
import com.flagship.bookstore.observability.PipelineMetrics;
import com.flagship.bookstore.projection.ProjectionDocument;
import com.flagship.bookstore.projection.ProjectionStore;
import com.flagship.bookstore.projection.catalog.AuthorDocument;
import com.flagship.bookstore.projection.catalog.AuthorStatisticsDocument;
import org.springframework.stereotype.Component;

import java.time.Clock;

@Component
public class AuthorStatisticsInvalidationHandler extends StatisticsInvalidationHandler<AuthorStatisticsDocument> {

    public AuthorStatisticsInvalidationHandler(TaggedCache cache, NotificationPublisher publisher,
                                               PipelineMetrics metrics, Clock clock, ProjectionStore store) {
        super(cache, publisher, metrics, clock, store);
    }

    @Override
    public Class<AuthorStatisticsDocument> documentType() {
        return AuthorStatisticsDocument.class;
    }

    @Override
    protected Class<? extends ProjectionDocument> parentType() {
        return AuthorDocument.class;
    }

    @Override
    protected EntityKind entityKind() {
        return EntityKind.AUTHOR;
    }
}
