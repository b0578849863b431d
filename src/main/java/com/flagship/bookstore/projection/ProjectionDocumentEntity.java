package com.flagship.bookstore.projection;

import jakarta.persistence.Column;
import jakarta.persistence.EmbeddedId;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

/**
 * JPA entity holding one projection document as JSON.
 *
 * Version, deleted flag and last-modified are copied out of the payload for monitoring queries.
 */
@Entity
@Table(name = "projection_documents")
@Getter
@Setter
@NoArgsConstructor
public class ProjectionDocumentEntity {

    @EmbeddedId
    private ProjectionDocumentKey key;

    @Column(name = "payload", nullable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String payload;

    @Column(name = "version", nullable = false)
    private long version;

    @Column(name = "deleted", nullable = false)
    private boolean deleted;

    @Column(name = "last_modified", nullable = false)
    private Instant lastModified;
}
