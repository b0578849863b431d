package com.flagship.bookstore.projection;

import lombok.Value;

/**
 * One changed document with its raw change kind.
 */
@Value
public class DocumentChange {
    ProjectionDocument document;
    ChangeKind kind;
}
