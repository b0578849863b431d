package com.flagship.bookstore.invalidation;

import com.flagship.bookstore.cache.EntityKind;
import com.flagship.bookstore.cache.TaggedCache;
import com.flagship.bookstore.notification.NotificationPublisher;
import com.flagship.bookstore.observability.PipelineMetrics;
import com.flagship.bookstore.projection.catalog.TenantDocument;
import org.springframework.stereotype.Component;

import java.time.Clock;

@Component
public class TenantInvalidationHandler extends EntityInvalidationHandler<TenantDocument> {

    public TenantInvalidationHandler(TaggedCache cache, NotificationPublisher publisher, PipelineMetrics metrics, Clock clock) {
        super(cache, publisher, metrics, clock);
    }

    @Override
    public Class<TenantDocument> documentType() {
        return TenantDocument.class;
    }

    @Override
    protected EntityKind entityKind() {
        return EntityKind.TENANT;
    }

    @Override
    protected String displayName(TenantDocument document) {
        return document.getName();
    }
}
