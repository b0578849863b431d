package com.flagship.bookstore.invalidation;

import com.flagship.bookstore.projection.ChangeKind;
import com.flagship.bookstore.projection.ProjectionDocument;

/**
 * Reacts to committed changes of one projection document type.
 *
 * Registered in {@link InvalidationHandlerRegistry} by {@link #documentType()}.
 */
public interface InvalidationHandler<D extends ProjectionDocument> {

    Class<D> documentType();

    /**
     * @param document the changed document; for a removed document, its last saved state
     * @param kind the effective change kind
     */
    void handle(D document, ChangeKind kind);

    /**
     * Handles a document whose type was only known at runtime.
     *
     * @throws ClassCastException if the document is not of {@link #documentType()}
     */
    default void handleChange(ProjectionDocument document, ChangeKind kind) {
        handle(documentType().cast(document), kind);
    }
}
