package com.flagship.bookstore.domain.author;

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
 * Author aggregate.
 *
 * Name is required (max 200 characters); biographies are optional per culture
 * (max 5000 characters each).
 */
@Value
@Builder(toBuilder = true)
public class Author implements Aggregate<Author> {

    public static final AggregateType<Author> TYPE = new AggregateType<>("Author", Author::empty);

    private static final int MAX_NAME_LENGTH = 200;
    private static final int MAX_BIOGRAPHY_LENGTH = 5000;

    UUID id;
    long version;
    String name;
    Map<String, String> biographies;
    boolean deleted;

    static Author empty(UUID id) {
        return new Author(id, 0, null, Map.of(), false);
    }

    public static AuthorAdded create(UUID id, String name, Map<String, String> biographies) {
        validate(name, biographies);
        return new AuthorAdded(id, name.trim(), Map.copyOf(biographies));
    }

    public AuthorUpdated update(String newName, Map<String, String> newBiographies) {
        if (deleted) {
            throw new DomainConflictException("Cannot update a deleted author");
        }
        validate(newName, newBiographies);
        return new AuthorUpdated(id, newName.trim(), Map.copyOf(newBiographies));
    }

    public AuthorSoftDeleted softDelete(Instant timestamp) {
        if (deleted) {
            throw new DomainConflictException("Author is already deleted");
        }
        return new AuthorSoftDeleted(id, timestamp);
    }

    public AuthorRestored restore(Instant timestamp) {
        if (!deleted) {
            throw new DomainConflictException("Author is not deleted");
        }
        return new AuthorRestored(id, timestamp);
    }

    @Override
    public Author apply(DomainEvent event, long version) {
        if (event instanceof AuthorAdded added) {
            return toBuilder().id(added.getAuthorId()).name(added.getName())
                    .biographies(added.getBiographies()).deleted(false).version(version).build();
        }
        if (event instanceof AuthorUpdated updated) {
            return toBuilder().name(updated.getName()).biographies(updated.getBiographies())
                    .version(version).build();
        }
        if (event instanceof AuthorSoftDeleted) {
            return toBuilder().deleted(true).version(version).build();
        }
        if (event instanceof AuthorRestored) {
            return toBuilder().deleted(false).version(version).build();
        }
        throw new IllegalArgumentException("Event " + event.getEventType() + " does not apply to Author");
    }

    private static void validate(String name, Map<String, String> biographies) {
        if (name == null || name.isBlank()) {
            throw new DomainValidationException("Author name is required");
        }
        if (name.trim().length() > MAX_NAME_LENGTH) {
            throw new DomainValidationException("Author name cannot exceed " + MAX_NAME_LENGTH + " characters");
        }
        if (biographies == null) {
            throw new DomainValidationException("Biographies cannot be null");
        }
        biographies.forEach((culture, biography) -> {
            if (culture == null || culture.isBlank()) {
                throw new DomainValidationException("Biography culture cannot be blank");
            }
            if (biography == null) {
                throw new DomainValidationException("Biography for '" + culture + "' cannot be null");
            }
            if (biography.length() > MAX_BIOGRAPHY_LENGTH) {
                throw new DomainValidationException(String.format(
                        "Biography for '%s' cannot exceed %d characters", culture, MAX_BIOGRAPHY_LENGTH));
            }
        });
    }
}
