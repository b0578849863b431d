package com.flagship.bookstore.invalidation;

import com.flagship.bookstore.cache.EntityKind;
import com.flagship.bookstore.cache.TaggedCache;
import com.flagship.bookstore.notification.NotificationPublisher;
import com.flagship.bookstore.observability.PipelineMetrics;
import com.flagship.bookstore.projection.ProjectionStore;
import com.flagship.bookstore.projection.catalog.CategoryDocument;
import com.flagship.bookstore.projection.catalog.CategoryStatisticsDocument;
import org.springframework.stereotype.Component;

import java.time.Clock;

@Component
public class CategoryInvalidationHandler extends EntityInvalidationHandler<CategoryDocument> {

    private static final String DEFAULT_CULTURE = "en";

    private final ProjectionStore store;

    public CategoryInvalidationHandler(TaggedCache cache, NotificationPublisher publisher, PipelineMetrics metrics,
                                       Clock clock, ProjectionStore store) {
        super(cache, publisher, metrics, clock);
        this.store = store;
    }

    @Override
    public Class<CategoryDocument> documentType() {
        return CategoryDocument.class;
    }

    @Override
    protected EntityKind entityKind() {
        return EntityKind.CATEGORY;
    }

    @Override
    protected String displayName(CategoryDocument document) {
        return document.nameFor(DEFAULT_CULTURE);
    }

    @Override
    protected long statisticsVersion(CategoryDocument document) {
        return versionOf(store, CategoryStatisticsDocument.class, document.getId());
    }
}
