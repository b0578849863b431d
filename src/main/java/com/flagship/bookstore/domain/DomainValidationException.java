package com.flagship.bookstore.domain;

/**
 * Thrown by aggregate mutators when input violates a business rule.
 * Mapped to 400 Bad Request at the API boundary.
 */
public class DomainValidationException extends RuntimeException {

    public DomainValidationException(String message) {
        super(message);
    }
}
