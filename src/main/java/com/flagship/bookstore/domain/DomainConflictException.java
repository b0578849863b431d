package com.flagship.bookstore.domain;

/**
 * A business rule violation caused by the aggregate's current state rather than
 * by the input alone (already deleted, overlapping sale, duplicate favorite).
 * Mapped to 409 Conflict.
 */
public class DomainConflictException extends DomainValidationException {

    public DomainConflictException(String message) {
        super(message);
    }
}
