package com.flagship.bookstore.domain.category;

import com.flagship.bookstore.domain.Aggregate;
import com.flagship.bookstore.domain.AggregateType;
import com.flagship.bookstore.domain.DomainConflictException;
import com.flagship.bookstore.domain.DomainEvent;
import com.flagship.bookstore.domain.DomainValidationException;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Category aggregate. A category has a localized name per culture and needs at least one.
 */
@Value
@Builder(toBuilder = true)
public class Category implements Aggregate<Category> {

    public static final AggregateType<Category> TYPE = new AggregateType<>("Category", Category::empty);

    private static final int MAX_NAME_LENGTH = 100;

    UUID id;
    long version;
    Map<String, String> names;
    boolean deleted;

    static Category empty(UUID id) {
        return new Category(id, 0, Map.of(), false);
    }

    public static CategoryAdded create(UUID id, Map<String, String> names) {
        validate(names);
        return new CategoryAdded(id, Map.copyOf(names));
    }

    public CategoryUpdated update(Map<String, String> newNames) {
        if (deleted) {
            throw new DomainConflictException("Cannot update a deleted category");
        }
        validate(newNames);
        return new CategoryUpdated(id, Map.copyOf(newNames));
    }

    public CategorySoftDeleted softDelete(Instant timestamp) {
        if (deleted) {
            throw new DomainConflictException("Category is already deleted");
        }
        return new CategorySoftDeleted(id, timestamp);
    }

    public CategoryRestored restore(Instant timestamp) {
        if (!deleted) {
            throw new DomainConflictException("Category is not deleted");
        }
        return new CategoryRestored(id, timestamp);
    }

    @Override
    public Category apply(DomainEvent event, long version) {
        if (event instanceof CategoryAdded added) {
            return toBuilder().id(added.getCategoryId()).names(added.getNames())
                    .deleted(false).version(version).build();
        }
        if (event instanceof CategoryUpdated updated) {
            return toBuilder().names(updated.getNames()).version(version).build();
        }
        if (event instanceof CategorySoftDeleted) {
            return toBuilder().deleted(true).version(version).build();
        }
        if (event instanceof CategoryRestored) {
            return toBuilder().deleted(false).version(version).build();
        }
        throw new IllegalArgumentException("Event " + event.getEventType() + " does not apply to Category");
    }

    private static void validate(Map<String, String> names) {
        if (names == null || names.isEmpty()) {
            throw new DomainValidationException("At least one category name is required");
        }
        names.forEach((culture, name) -> {
            if (culture == null || culture.isBlank()) {
                throw new DomainValidationException("Category name culture cannot be blank");
            }
            if (name == null || name.isBlank()) {
                throw new DomainValidationException("Category name for '" + culture + "' is required");
            }
            if (name.length() > MAX_NAME_LENGTH) {
                throw new DomainValidationException(String.format(
                        "Category name for '%s' cannot exceed %d characters", culture, MAX_NAME_LENGTH));
            }
        });
    }
}
