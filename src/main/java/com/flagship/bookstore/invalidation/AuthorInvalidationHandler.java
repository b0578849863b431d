package com.flagship.bookstore.invalidation;

import com.flagship.bookstore.cache.EntityKind;
import com.flagship.bookstore.cache.TaggedCache;
import com.flagship.bookstore.notification.NotificationPublisher;
import com.flagship.bookstore.observability.PipelineMetrics;
import com.flagship.bookstore.projection.ProjectionStore;
import com.flagship.bookstore.projection.catalog.AuthorDocument;
import com.flagship.bookstore.projection.catalog.AuthorStatisticsDocument;
import org.springframework.stereotype.Component;

import java.time.Clock;

@Component
public class AuthorInvalidationHandler extends EntityInvalidationHandler<AuthorDocument> {

    private final ProjectionStore store;

    public AuthorInvalidationHandler(TaggedCache cache, NotificationPublisher publisher, PipelineMetrics metrics,
                                     Clock clock, ProjectionStore store) {
        super(cache, publisher, metrics, clock);
        this.store = store;
    }

    @Override
    public Class<AuthorDocument> documentType() {
        return AuthorDocument.class;
    }

    @Override
    protected EntityKind entityKind() {
        return EntityKind.AUTHOR;
    }

    @Override
    protected String displayName(AuthorDocument document) {
        return document.getName();
    }

    @Override
    protected long statisticsVersion(AuthorDocument document) {
        return versionOf(store, AuthorStatisticsDocument.class, document.getId());
    }
}
