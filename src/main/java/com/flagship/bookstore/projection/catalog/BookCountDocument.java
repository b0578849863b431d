package com.flagship.bookstore.projection.catalog;

import com.flagship.bookstore.projection.ProjectionDocument;

import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Number of live books linked to a catalog entity. The document id is the entity id.
 */
public interface BookCountDocument extends ProjectionDocument {

    int getBookCount();

    /**
     * Per book stream, the version of the latest event folded into this document.
     */
    Map<UUID, Long> getBookVersions();

    /**
     * Books that currently link the entity and are not deleted.
     */
    Set<UUID> getBookIds();
}
