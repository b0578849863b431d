package com.flagship.bookstore.invalidation;

import com.flagship.bookstore.cache.EntityKind;
import com.flagship.bookstore.cache.TaggedCache;
import com.flagship.bookstore.notification.NotificationPublisher;
import com.flagship.bookstore.observability.PipelineMetrics;
import com.flagship.bookstore.projection.ChangeKind;
import com.flagship.bookstore.projection.catalog.UserProfileDocument;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Profiles are never created or deleted from a reader's point of view; every change
 * is announced as {@code UserUpdated}.
 */
@Component
public class UserProfileInvalidationHandler extends EntityInvalidationHandler<UserProfileDocument> {

    public UserProfileInvalidationHandler(TaggedCache cache, NotificationPublisher publisher,
                                          PipelineMetrics metrics, Clock clock) {
        super(cache, publisher, metrics, clock);
    }

    @Override
    public Class<UserProfileDocument> documentType() {
        return UserProfileDocument.class;
    }

    @Override
    protected EntityKind entityKind() {
        return EntityKind.USER;
    }

    @Override
    protected String displayName(UserProfileDocument document) {
        return null;
    }

    @Override
    protected ChangeKind notificationKind(ChangeKind kind) {
        return ChangeKind.UPDATE;
    }
}
