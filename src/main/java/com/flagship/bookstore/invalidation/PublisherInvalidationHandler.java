package com.flagship.bookstore.invalidation;

import com.flagship.bookstore.cache.EntityKind;
import com.flagship.bookstore.cache.TaggedCache;
import com.flagship.bookstore.notification.NotificationPublisher;
import com.flagship.bookstore.observability.PipelineMetrics;
import com.flagship.bookstore.projection.ProjectionStore;
import com.flagship.bookstore.projection.catalog.PublisherDocument;
import com.flagship.bookstore.projection.catalog.PublisherStatisticsDocument;
import org.springframework.stereotype.Component;

import java.time.Clock;

@Component
public class PublisherInvalidationHandler extends EntityInvalidationHandler<PublisherDocument> {

    private final ProjectionStore store;

    public PublisherInvalidationHandler(TaggedCache cache, NotificationPublisher publisher, PipelineMetrics metrics,
                                        Clock clock, ProjectionStore store) {
        super(cache, publisher, metrics, clock);
        this.store = store;
    }

    @Override
    public Class<PublisherDocument> documentType() {
        return PublisherDocument.class;
    }

    @Override
    protected EntityKind entityKind() {
        return EntityKind.PUBLISHER;
    }

    @Override
    protected String displayName(PublisherDocument document) {
        return document.getName();
    }

    @Override
    protected long statisticsVersion(PublisherDocument document) {
        return versionOf(store, PublisherStatisticsDocument.class, document.getId());
    }
}
