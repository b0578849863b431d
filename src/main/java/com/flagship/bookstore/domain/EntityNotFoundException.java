package com.flagship.bookstore.domain;

import java.util.UUID;

/**
 * Thrown when a stream, a projection document or a nested item does not exist.
 */
public class EntityNotFoundException extends RuntimeException {

    public EntityNotFoundException(String entityType, UUID id) {
        super(String.format("%s not found: %s", entityType, id));
    }

    public EntityNotFoundException(String message) {
        super(message);
    }
}
