package com.flagship.bookstore.projection;

import com.flagship.bookstore.cache.TaggedCache;
import com.flagship.bookstore.eventstore.EventStore;
import com.flagship.bookstore.eventstore.StoredEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Rebuilds every projection document from the event store.
 *
 * 1. Clears the projection store
 * 2. Replays all events in sequence order, page by page, without notifying listeners
 * 3. Clears the cache, since no per-document invalidation was emitted
 *
 * Holds the worker's lock throughout, so the daemon cannot interleave a drain.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ProjectionRebuilder {

    private final EventStore eventStore;
    private final ProjectionStore projectionStore;
    private final ProjectionWorker worker;
    private final TaggedCache cache;

    @Value("${bookstore.projections.batch-size:100}")
    private int pageSize;

    public RebuildResult rebuild() {
        synchronized (worker) {
            log.info("Rebuilding projections from the event store");
            projectionStore.clear();

            long afterSequence = 0;
            long events = 0;
            long documentWrites = 0;
            List<StoredEvent> page = eventStore.readAfter(afterSequence, Math.max(pageSize, 1));
            while (!page.isEmpty()) {
                documentWrites += worker.replay(page);
                events += page.size();
                afterSequence = page.get(page.size() - 1).getSequence();
                page = eventStore.readAfter(afterSequence, Math.max(pageSize, 1));
            }

            cache.clear();
            log.info("Projection rebuild complete: events={}, documentWrites={}", events, documentWrites);
            return new RebuildResult(events, documentWrites);
        }
    }

    public record RebuildResult(long events, long documentWrites) {
    }
}
