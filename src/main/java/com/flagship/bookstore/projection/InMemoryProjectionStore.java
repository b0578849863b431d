package com.flagship.bookstore.projection;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

@Component
@ConditionalOnProperty(name = "bookstore.store.type", havingValue = "memory")
public class InMemoryProjectionStore implements ProjectionStore {

    private final Map<Class<?>, Map<UUID, ProjectionDocument>> documents = new ConcurrentHashMap<>();
    private final AtomicLong checkpoint = new AtomicLong();

    @Override
    public <D extends ProjectionDocument> Optional<D> find(Class<D> type, UUID id) {
        return Optional.ofNullable(documentsOf(type).get(id)).map(type::cast);
    }

    @Override
    public void save(ProjectionDocument document) {
        documentsOf(document.getClass()).put(document.getId(), document);
    }

    @Override
    public void delete(Class<? extends ProjectionDocument> type, UUID id) {
        documentsOf(type).remove(id);
    }

    @Override
    public <D extends ProjectionDocument> List<D> findAll(Class<D> type) {
        return documentsOf(type).values().stream().map(type::cast).toList();
    }

    @Override
    public void clear() {
        documents.clear();
    }

    @Override
    public long checkpoint() {
        return checkpoint.get();
    }

    @Override
    public void saveCheckpoint(long sequence) {
        checkpoint.set(sequence);
    }

    private Map<UUID, ProjectionDocument> documentsOf(Class<?> type) {
        return documents.computeIfAbsent(type, t -> new ConcurrentHashMap<>());
    }
}
