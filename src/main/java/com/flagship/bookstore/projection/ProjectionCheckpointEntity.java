package com.flagship.bookstore.projection;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * Highest event sequence up to which every event has been folded.
 */
@Entity
@Table(name = "projection_checkpoints")
@Getter
@Setter
@NoArgsConstructor
public class ProjectionCheckpointEntity {

    @Id
    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "sequence_number", nullable = false)
    private long sequence;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public static ProjectionCheckpointEntity create(String name, long sequence, Instant updatedAt) {
        ProjectionCheckpointEntity entity = new ProjectionCheckpointEntity();
        entity.name = name;
        entity.sequence = sequence;
        entity.updatedAt = updatedAt;
        return entity;
    }
}
