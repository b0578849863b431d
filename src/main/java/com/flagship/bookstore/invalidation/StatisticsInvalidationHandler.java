package com.flagship.bookstore.invalidation;

import com.flagship.bookstore.cache.TaggedCache;
import com.flagship.bookstore.notification.NotificationPublisher;
import com.flagship.bookstore.observability.PipelineMetrics;
import com.flagship.bookstore.projection.ChangeKind;
import com.flagship.bookstore.projection.ProjectionDocument;
import com.flagship.bookstore.projection.ProjectionStore;

import java.time.Clock;

/**
 * Statistics are served as part of their parent entity, so a change refreshes the parent:
 * its tags are invalidated and an {@code {Entity}Updated} notification is sent carrying the
 * parent's stream version and the tag its GET now returns.
 *
 * @param <D> statistics document type
 */
public abstract class StatisticsInvalidationHandler<D extends ProjectionDocument> extends EntityInvalidationHandler<D> {

    static final String DISPLAY_NAME = "Statistics Updated";

    private final ProjectionStore store;

    protected StatisticsInvalidationHandler(TaggedCache cache, NotificationPublisher publisher,
                                            PipelineMetrics metrics, Clock clock, ProjectionStore store) {
        super(cache, publisher, metrics, clock);
        this.store = store;
    }

    /**
     * Document type of the parent entity.
     */
    protected abstract Class<? extends ProjectionDocument> parentType();

    @Override
    protected long entityVersion(D document) {
        return versionOf(store, parentType(), entityId(document));
    }

    @Override
    protected long statisticsVersion(D document) {
        return document.getVersion();
    }

    @Override
    protected String displayName(D document) {
        return DISPLAY_NAME;
    }

    @Override
    protected ChangeKind notificationKind(ChangeKind kind) {
        return ChangeKind.UPDATE;
    }
}
