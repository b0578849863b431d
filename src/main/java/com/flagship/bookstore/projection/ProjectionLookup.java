package com.flagship.bookstore.projection;

import java.util.Optional;
import java.util.UUID;

/**
 * Read-only access to other documents, used by projections to denormalize related data.
 */
public interface ProjectionLookup {

    <D extends ProjectionDocument> Optional<D> find(Class<D> type, UUID id);
}
