package com.flagship.bookstore.invalidation;

import com.flagship.bookstore.cache.EntityKind;
import com.flagship.bookstore.cache.TaggedCache;
import com.flagship.bookstore.notification.NotificationPublisher;
import com.flagship.bookstore.observability.PipelineMetrics;
import com.flagship.bookstore.projection.ProjectionDocument;
import com.flagship.bookstore.projection.ProjectionStore;
import com.flagship.bookstore.projection.catalog.CategoryDocument;
import com.flagship.bookstore.projection.catalog.CategoryStatisticsDocument;
import org.springframework.stereotype.Component;

import java.time.Clock;

@Component
public class CategoryStatisticsInvalidationHandler extends StatisticsInvalidationHandler<CategoryStatisticsDocument> {

    public CategoryStatisticsInvalidationHandler(TaggedCache cache, NotificationPublisher publisher,
                                                 PipelineMetrics metrics, Clock clock, ProjectionStore store) {
        super(cache, publisher, metrics, clock, store);
    }

    @Override
    public Class<CategoryStatisticsDocument> documentType() {
        return CategoryStatisticsDocument.class;
    }

    @Override
    protected Class<? extends ProjectionDocument> parentType() {
        return CategoryDocument.class;
    }

    @Override
    protected EntityKind entityKind() {
        return EntityKind.CATEGORY;
    }
}
