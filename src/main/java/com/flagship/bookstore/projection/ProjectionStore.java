package com.flagship.bookstore.projection;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;

import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.function.Predicate;

/**
 * Storage for projection documents.
 *
 * Queries filter, sort and page in memory over all documents of a type.
 */
public interface ProjectionStore extends ProjectionLookup {

    void save(ProjectionDocument document);

    void delete(Class<? extends ProjectionDocument> type, UUID id);

    <D extends ProjectionDocument> List<D> findAll(Class<D> type);

    /**
     * Removes every document of every type. Used before a full rebuild.
     */
    void clear();

    /**
     * Sequence up to which every stored event is known to be folded, 0 if none.
     */
    long checkpoint();

    void saveCheckpoint(long sequence);

    default <D extends ProjectionDocument> Page<D> query(Class<D> type, Predicate<? super D> filter,
                                                         Comparator<? super D> sort, int page, int size) {
        List<D> matching = findAll(type).stream()
                .filter(filter)
                .sorted(sort)
                .toList();
        long offset = (long) page * size;
        int from = (int) Math.min(offset, matching.size());
        int to = Math.min(from + size, matching.size());
        return new PageImpl<>(matching.subList(from, to), PageRequest.of(page, size), matching.size());
    }
}
