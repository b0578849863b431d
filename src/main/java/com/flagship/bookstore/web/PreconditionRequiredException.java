package com.flagship.bookstore.web;

/**
 * A write arrived without {@code If-Match} while conditional writes are mandatory.
 */
public class PreconditionRequiredException extends RuntimeException {

    public PreconditionRequiredException(String message) {
        super(message);
    }
}
