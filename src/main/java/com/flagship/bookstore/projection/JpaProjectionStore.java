package com.flagship.bookstore.projection;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL-backed document store. Documents are keyed by (simple class name, id).
 */
@Component
@ConditionalOnProperty(name = "bookstore.store.type", havingValue = "jpa", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class JpaProjectionStore implements ProjectionStore {

    static final String CHECKPOINT_NAME = "catalog";

    private final ProjectionDocumentRepository repository;
    private final ProjectionCheckpointRepository checkpoints;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public <D extends ProjectionDocument> Optional<D> find(Class<D> type, UUID id) {
        return repository.findById(new ProjectionDocumentKey(typeName(type), id))
                .map(entity -> read(entity, type));
    }

    @Override
    @Transactional
    public void save(ProjectionDocument document) {
        ProjectionDocumentEntity entity = new ProjectionDocumentEntity();
        entity.setKey(new ProjectionDocumentKey(typeName(document.getClass()), document.getId()));
        entity.setPayload(write(document));
        entity.setVersion(document.getVersion());
        entity.setDeleted(document.isDeleted());
        entity.setLastModified(document.getLastModified());
        repository.save(entity);
    }

    @Override
    @Transactional
    public void delete(Class<? extends ProjectionDocument> type, UUID id) {
        repository.deleteById(new ProjectionDocumentKey(typeName(type), id));
    }

    @Override
    @Transactional(readOnly = true)
    public <D extends ProjectionDocument> List<D> findAll(Class<D> type) {
        return repository.findByKeyDocumentType(typeName(type))
                .stream()
                .map(entity -> read(entity, type))
                .toList();
    }

    @Override
    @Transactional
    public void clear() {
        long count = repository.count();
        repository.deleteAllInBatch();
        log.info("Cleared {} projection documents", count);
    }

    @Override
    @Transactional(readOnly = true)
    public long checkpoint() {
        return checkpoints.findById(CHECKPOINT_NAME)
                .map(ProjectionCheckpointEntity::getSequence)
                .orElse(0L);
    }

    @Override
    @Transactional
    public void saveCheckpoint(long sequence) {
        checkpoints.save(ProjectionCheckpointEntity.create(CHECKPOINT_NAME, sequence, clock.instant()));
    }

    private static String typeName(Class<?> type) {
        return type.getSimpleName();
    }

    private String write(ProjectionDocument document) {
        try {
            return objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize " + typeName(document.getClass()), e);
        }
    }

    private <D extends ProjectionDocument> D read(ProjectionDocumentEntity entity, Class<D> type) {
        try {
            return objectMapper.readValue(entity.getPayload(), type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(String.format(
                    "Failed to deserialize %s %s", typeName(type), entity.getKey().getDocumentId()), e);
        }
    }
}
