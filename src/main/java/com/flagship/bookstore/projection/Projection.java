package com.flagship.bookstore.projection;

import com.flagship.bookstore.eventstore.StoredEvent;

import java.util.Set;
import java.util.UUID;

/**
 * Folds events into documents of one type.
 *
 * @param <D> document type produced by this projection
 */
public interface Projection<D extends ProjectionDocument> {

    Class<D> documentType();

    /**
     * Returns the ids of the documents the event contributes to, empty if this projection ignores it.
     *
     * Called before the event is folded by any projection, so the lookup shows the
     * documents as they were before the event.
     */
    Set<UUID> identify(StoredEvent event, ProjectionLookup lookup);

    /**
     * Folds one event into the current document.
     *
     * Must be idempotent: folding an event the document already reflects returns
     * the document unchanged. Returning null removes the document.
     *
     * @param documentId one of the ids returned by {@link #identify}
     * @param current the current document, or null if none exists yet
     * @throws RuntimeException if the event cannot be folded; the caller keeps the last saved document
     */
    D fold(UUID documentId, D current, StoredEvent event, ProjectionLookup lookup);
}
