package com.flagship.bookstore.catalog;

import lombok.Value;

import java.util.UUID;

/**
 * Outcome of a command: the stream it wrote to and the version after the append.
 */
@Value
public class CommandResult {
    UUID id;
    long version;
}
