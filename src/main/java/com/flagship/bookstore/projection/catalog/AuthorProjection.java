package com.flagship.bookstore.projection.catalog;

import com.flagship.bookstore.domain.DomainEvent;
import com.flagship.bookstore.domain.author.Author;
import com.flagship.bookstore.domain.author.AuthorAdded;
import com.flagship.bookstore.domain.author.AuthorRestored;
import com.flagship.bookstore.domain.author.AuthorSoftDeleted;
import com.flagship.bookstore.domain.author.AuthorUpdated;
import com.flagship.bookstore.eventstore.StoredEvent;
import com.flagship.bookstore.projection.ProjectionLookup;
import com.flagship.bookstore.projection.SingleStreamProjection;
import org.springframework.stereotype.Component;

@Component
public class AuthorProjection extends SingleStreamProjection<AuthorDocument> {

    public AuthorProjection() {
        super(Author.TYPE.getName());
    }

    @Override
    public Class<AuthorDocument> documentType() {
        return AuthorDocument.class;
    }

    @Override
    protected AuthorDocument apply(AuthorDocument current, StoredEvent event, ProjectionLookup lookup) {
        DomainEvent data = event.getData();
        if (data instanceof AuthorAdded added) {
            return AuthorDocument.builder()
                    .id(added.getAuthorId())
                    .version(event.getVersion())
                    .lastModified(event.getTimestamp())
                    .name(added.getName())
                    .biographies(added.getBiographies())
                    .build();
        }

        AuthorDocument.AuthorDocumentBuilder next = requireExisting(current, event).toBuilder()
                .version(event.getVersion())
                .lastModified(event.getTimestamp());
        if (data instanceof AuthorUpdated updated) {
            return next.name(updated.getName()).biographies(updated.getBiographies()).build();
        }
        if (data instanceof AuthorSoftDeleted deleted) {
            return next.deleted(true).deletedAt(deleted.getDeletedAt()).build();
        }
        if (data instanceof AuthorRestored) {
            return next.deleted(false).deletedAt(null).build();
        }
        throw unsupported(event);
    }
}
