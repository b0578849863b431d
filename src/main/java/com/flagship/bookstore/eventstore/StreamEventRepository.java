package com.flagship.bookstore.eventstore;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface StreamEventRepository extends JpaRepository<StreamEventEntity, Long> {

    List<StreamEventEntity> findByStreamIdOrderByVersionAsc(UUID streamId);

    @Query("SELECT MAX(e.version) FROM StreamEventEntity e WHERE e.streamId = :streamId")
    Optional<Long> findCurrentVersion(@Param("streamId") UUID streamId);

    /**
     * Global read in append order, used by projection rebuilds.
     */
    List<StreamEventEntity> findBySequenceNumberGreaterThanOrderBySequenceNumberAsc(long afterSequence, Pageable page);
}
