package com.flagship.bookstore.invalidation;

import com.flagship.bookstore.cache.EntityKind;
import com.flagship.bookstore.cache.TaggedCache;
import com.flagship.bookstore.notification.NotificationPublisher;
import com.flagship.bookstore.observability.PipelineMetrics;
import com.flagship.bookstore.projection.ProjectionDocument;
import com.flagship.bookstore.projection.ProjectionStore;
import com.flagship.bookstore.projection.catalog.PublisherDocument;
import com.flagship.bookstore.projection.catalog.PublisherStatisticsDocument;
import org.springframework.stereotype.Component;

import java.time.Clock;

@Component
public class PublisherStatisticsInvalidationHandler extends StatisticsInvalidationHandler<PublisherStatisticsDocument> {

    public PublisherStatisticsInvalidationHandler(TaggedCache cache, NotificationPublisher publisher,
                                                  PipelineMetrics metrics, Clock clock, ProjectionStore store) {
        super(cache, publisher, metrics, clock, store);
    }

    @Override
    public Class<PublisherStatisticsDocument> documentType() {
        return PublisherStatisticsDocument.class;
    }

    @Override
    protected Class<? extends ProjectionDocument> parentType() {
        return PublisherDocument.class;
    }

    @Override
    protected EntityKind entityKind() {
        return EntityKind.PUBLISHER;
    }
}
