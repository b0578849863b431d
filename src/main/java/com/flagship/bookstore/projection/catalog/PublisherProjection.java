package com.flagship.bookstore.projection.catalog;

import com.flagship.bookstore.domain.DomainEvent;
import com.flagship.bookstore.domain.publisher.Publisher;
import com.flagship.bookstore.domain.publisher.PublisherAdded;
import com.flagship.bookstore.domain.publisher.PublisherRestored;
import com.flagship.bookstore.domain.publisher.PublisherSoftDeleted;
import com.flagship.bookstore.domain.publisher.PublisherUpdated;
import com.flagship.bookstore.eventstore.StoredEvent;
import com.flagship.bookstore.projection.ProjectionLookup;
import com.flagship.bookstore.projection.SingleStreamProjection;
import org.springframework.stereotype.Component;

@Component
public class PublisherProjection extends SingleStreamProjection<PublisherDocument> {

    public PublisherProjection() {
        super(Publisher.TYPE.getName());
    }

    @Override
    public Class<PublisherDocument> documentType() {
        return PublisherDocument.class;
    }

    @Override
    protected PublisherDocument apply(PublisherDocument current, StoredEvent event, ProjectionLookup lookup) {
        DomainEvent data = event.getData();
        if (data instanceof PublisherAdded added) {
            return PublisherDocument.builder()
                    .id(added.getPublisherId())
                    .version(event.getVersion())
                    .lastModified(event.getTimestamp())
                    .name(added.getName())
                    .build();
        }

        PublisherDocument.PublisherDocumentBuilder next = requireExisting(current, event).toBuilder()
                .version(event.getVersion())
                .lastModified(event.getTimestamp());
        if (data instanceof PublisherUpdated updated) {
            return next.name(updated.getName()).build();
        }
        if (data instanceof PublisherSoftDeleted deleted) {
            return next.deleted(true).deletedAt(deleted.getDeletedAt()).build();
        }
        if (data instanceof PublisherRestored) {
            return next.deleted(false).deletedAt(null).build();
        }
        throw unsupported(event);
    }
}
