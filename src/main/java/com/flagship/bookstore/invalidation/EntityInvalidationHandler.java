package com.flagship.bookstore.invalidation;

import com.flagship.bookstore.cache.CacheTag;
import com.flagship.bookstore.cache.EntityKind;
import com.flagship.bookstore.cache.TaggedCache;
import com.flagship.bookstore.notification.DomainNotification;
import com.flagship.bookstore.notification.NotificationPublisher;
import com.flagship.bookstore.observability.PipelineMetrics;
import com.flagship.bookstore.projection.ChangeKind;
import com.flagship.bookstore.projection.ProjectionDocument;
import com.flagship.bookstore.projection.ProjectionLookup;
import com.flagship.bookstore.web.ETags;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.UUID;

/**
 * Invalidation for documents that describe one catalog entity.
 *
 * Steps, always in this order:
 * 1. Remove the entity's item tag
 * 2. Remove the entity kind's collection tag
 * 3. Publish exactly one notification
 *
 * Each step is attempted even when an earlier one failed. Failures are logged at
 * error and counted; a failed tag removal means a stale entry until its TTL expires.
 */
@Slf4j
public abstract class EntityInvalidationHandler<D extends ProjectionDocument> implements InvalidationHandler<D> {

    private final TaggedCache cache;
    private final NotificationPublisher publisher;
    private final PipelineMetrics metrics;
    private final Clock clock;

    protected EntityInvalidationHandler(TaggedCache cache, NotificationPublisher publisher,
                                        PipelineMetrics metrics, Clock clock) {
        this.cache = cache;
        this.publisher = publisher;
        this.metrics = metrics;
        this.clock = clock;
    }

    protected abstract EntityKind entityKind();

    /**
     * Display name for the notification, null where the entity has none.
     */
    protected abstract String displayName(D document);

    /**
     * Id of the entity whose tags are invalidated. Defaults to the document id.
     */
    protected UUID entityId(D document) {
        return document.getId();
    }

    /**
     * Stream version of the entity. Defaults to the document version.
     */
    protected long entityVersion(D document) {
        return document.getVersion();
    }

    /**
     * Version of the statistics document served with the entity, 0 if none.
     */
    protected long statisticsVersion(D document) {
        return 0;
    }

    protected ChangeKind notificationKind(ChangeKind kind) {
        return kind;
    }

    /**
     * {@code {Entity}{Created|Updated|Deleted}}.
     */
    protected String eventType(ChangeKind kind) {
        String suffix = switch (kind) {
            case INSERT -> "Created";
            case UPDATE -> "Updated";
            case DELETE -> "Deleted";
        };
        return entityKind().getDisplayName() + suffix;
    }

    @Override
    public final void handle(D document, ChangeKind kind) {
        EntityKind entityKind = entityKind();
        UUID entityId = entityId(document);

        invalidate(CacheTag.item(entityKind, entityId));
        invalidate(CacheTag.collection(entityKind));

        ChangeKind notified = notificationKind(kind);
        long version = entityVersion(document);
        DomainNotification notification = DomainNotification.builder()
                .eventId(UUID.randomUUID())
                .eventType(eventType(notified))
                .entityType(entityKind.getDisplayName())
                .entityId(entityId)
                .changeKind(notified)
                .name(displayName(document))
                .timestamp(clock.instant())
                .version(version)
                .etag(ETags.generate(version, statisticsVersion(document)))
                .build();
        try {
            publisher.publish(notification);
        } catch (Exception e) {
            log.error("Failed to publish notification: eventType={}, entityId={}, error={}",
                    notification.getEventType(), entityId, e.getMessage());
            metrics.recordNotification(publisher.transport(), false);
        }
    }

    protected static long versionOf(ProjectionLookup lookup, Class<? extends ProjectionDocument> type, UUID id) {
        return lookup.find(type, id).map(ProjectionDocument::getVersion).orElse(0L);
    }

    private void invalidate(CacheTag tag) {
        try {
            cache.removeByTag(tag);
            metrics.recordCacheInvalidation(true);
            log.debug("Invalidated cache tag {}", tag);
        } catch (Exception e) {
            log.error("Failed to invalidate cache tag {}; entries stay stale until they expire. Error: {}",
                    tag, e.getMessage());
            metrics.recordCacheInvalidation(false);
        }
    }
}
