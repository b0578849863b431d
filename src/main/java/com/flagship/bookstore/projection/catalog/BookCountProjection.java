package com.flagship.bookstore.projection.catalog;

import com.flagship.bookstore.domain.DomainEvent;
import com.flagship.bookstore.domain.book.Book;
import com.flagship.bookstore.domain.book.BookAdded;
import com.flagship.bookstore.domain.book.BookDetails;
import com.flagship.bookstore.domain.book.BookRestored;
import com.flagship.bookstore.domain.book.BookSoftDeleted;
import com.flagship.bookstore.domain.book.BookUpdated;
import com.flagship.bookstore.eventstore.StoredEvent;
import com.flagship.bookstore.projection.Projection;
import com.flagship.bookstore.projection.ProjectionLookup;

import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Counts live books per linked entity, one document per entity.
 *
 * Routing:
 * - BookAdded goes to the entities its details link
 * - BookUpdated goes to the newly linked entities and to the ones the book linked before
 * - BookSoftDeleted and BookRestored go to the entities the book links
 *
 * The previous links come from the book search document as it was before the event.
 * Every routed event settles whether the book counts for the entity, so per book the
 * event with the highest stream version wins and older ones are skipped.
 *
 * @param <D> statistics document type
 */
public abstract class BookCountProjection<D extends BookCountDocument> implements Projection<D> {

    /**
     * Entities the given book details link.
     */
    protected abstract Collection<UUID> linkedIds(BookDetails details);

    /**
     * Entities the projected book links.
     */
    protected abstract Collection<UUID> linkedIds(BookSearchDocument book);

    protected abstract D create(UUID entityId, long version, Instant lastModified,
                                Map<UUID, Long> bookVersions, Set<UUID> bookIds);

    @Override
    public Set<UUID> identify(StoredEvent event, ProjectionLookup lookup) {
        if (!Book.TYPE.getName().equals(event.getStreamType())) {
            return Set.of();
        }
        DomainEvent data = event.getData();
        Set<UUID> ids = new LinkedHashSet<>();
        if (data instanceof BookAdded added) {
            ids.addAll(linkedIds(added.getDetails()));
        } else if (data instanceof BookUpdated updated) {
            ids.addAll(linkedIds(updated.getDetails()));
            ids.addAll(previouslyLinked(event, lookup));
        } else if (data instanceof BookSoftDeleted || data instanceof BookRestored) {
            ids.addAll(previouslyLinked(event, lookup));
        }
        return ids;
    }

    @Override
    public D fold(UUID documentId, D current, StoredEvent event, ProjectionLookup lookup) {
        UUID bookId = event.getStreamId();
        Map<UUID, Long> bookVersions = current == null ? Map.of() : current.getBookVersions();
        if (event.getVersion() <= bookVersions.getOrDefault(bookId, 0L)) {
            return current;
        }

        Map<UUID, Long> nextVersions = new HashMap<>(bookVersions);
        nextVersions.put(bookId, event.getVersion());
        Set<UUID> nextBookIds = current == null ? new HashSet<>() : new HashSet<>(current.getBookIds());
        if (counts(documentId, event)) {
            nextBookIds.add(bookId);
        } else {
            nextBookIds.remove(bookId);
        }

        long version = current == null ? 1 : current.getVersion() + 1;
        return create(documentId, version, event.getTimestamp(), nextVersions, nextBookIds);
    }

    private boolean counts(UUID entityId, StoredEvent event) {
        DomainEvent data = event.getData();
        if (data instanceof BookAdded added) {
            return linkedIds(added.getDetails()).contains(entityId);
        }
        if (data instanceof BookUpdated updated) {
            return linkedIds(updated.getDetails()).contains(entityId);
        }
        if (data instanceof BookSoftDeleted) {
            return false;
        }
        if (data instanceof BookRestored) {
            return true;
        }
        throw new IllegalArgumentException(String.format(
                "%s cannot fold %s", getClass().getSimpleName(), event.getEventType()));
    }

    private Collection<UUID> previouslyLinked(StoredEvent event, ProjectionLookup lookup) {
        return lookup.find(BookSearchDocument.class, event.getStreamId())
                .map(this::linkedIds)
                .orElse(List.of());
    }
}
