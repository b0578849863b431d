package com.flagship.bookstore.projection.catalog;

import com.flagship.bookstore.domain.DomainEvent;
import com.flagship.bookstore.domain.category.Category;
import com.flagship.bookstore.domain.category.CategoryAdded;
import com.flagship.bookstore.domain.category.CategoryRestored;
import com.flagship.bookstore.domain.category.CategorySoftDeleted;
import com.flagship.bookstore.domain.category.CategoryUpdated;
import com.flagship.bookstore.eventstore.StoredEvent;
import com.flagship.bookstore.projection.ProjectionLookup;
import com.flagship.bookstore.projection.SingleStreamProjection;
import org.springframework.stereotype.Component;

@Component
public class CategoryProjection extends SingleStreamProjection<CategoryDocument> {

    public CategoryProjection() {
        super(Category.TYPE.getName());
    }

    @Override
    public Class<CategoryDocument> documentType() {
        return CategoryDocument.class;
    }

    @Override
    protected CategoryDocument apply(CategoryDocument current, StoredEvent event, ProjectionLookup lookup) {
        DomainEvent data = event.getData();
        if (data instanceof CategoryAdded added) {
            return CategoryDocument.builder()
                    .id(added.getCategoryId())
                    .version(event.getVersion())
                    .lastModified(event.getTimestamp())
                    .names(added.getNames())
                    .build();
        }

        CategoryDocument.CategoryDocumentBuilder next = requireExisting(current, event).toBuilder()
                .version(event.getVersion())
                .lastModified(event.getTimestamp());
        if (data instanceof CategoryUpdated updated) {
            return next.names(updated.getNames()).build();
        }
        if (data instanceof CategorySoftDeleted deleted) {
            return next.deleted(true).deletedAt(deleted.getDeletedAt()).build();
        }
        if (data instanceof CategoryRestored) {
            return next.deleted(false).deletedAt(null).build();
        }
        throw unsupported(event);
    }
}
