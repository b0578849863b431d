package com.flagship.bookstore.projection;

import com.flagship.bookstore.eventstore.EventStore;
import com.flagship.bookstore.eventstore.StoredEvent;
import com.flagship.bookstore.eventstore.StreamAppended;
import com.flagship.bookstore.observability.CorrelationContext;
import com.flagship.bookstore.observability.PipelineMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Folds appended events into projection documents and notifies commit listeners.
 *
 * For each {@link StreamAppended} message:
 * 1. Every projection identifies the document each event belongs to
 * 2. Documents are loaded once and folded event by event in a working set
 * 3. Changed documents are saved, classified as inserted, updated or deleted
 * 4. Every {@link ProjectionCommitListener} receives one change set
 *
 * Failure handling:
 * - A fold that throws stops that document; it keeps its last saved state
 * - Other documents of the same message are still saved and reported
 * - The message is re-queued; already folded events are skipped on retry
 * - After max-retries the message is dead-lettered
 *
 * The channel only lives in this process. {@link #catchUp()} reads the event store past a
 * persisted checkpoint, so lost, dead-lettered or out-of-order messages still converge.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ProjectionWorker {

    private final ProjectionChannel channel;
    private final ProjectionStore store;
    private final EventStore eventStore;
    private final List<Projection<?>> projections;
    private final List<ProjectionCommitListener> listeners;
    private final PipelineMetrics metrics;
    private final Clock clock;

    @Value("${bookstore.projections.max-retries:5}")
    private int maxRetries;

    @Value("${bookstore.projections.batch-size:100}")
    private int batchSize;

    @Value("${bookstore.projections.catch-up-settle-ms:5000}")
    private long catchUpSettleMillis;

    private final AtomicLong deadLettered = new AtomicLong();
    private volatile Instant lastDrainAt;

    /**
     * Processes the messages queued when the call starts.
     *
     * Re-queued messages wait for the next call, so a failing stream cannot spin.
     *
     * @return number of messages processed
     */
    public synchronized int drain() {
        int pending = channel.size();
        int processed = 0;
        while (processed < pending) {
            List<StreamAppended> batch = channel.take(Math.min(Math.max(batchSize, 1), pending - processed));
            if (batch.isEmpty()) {
                break;
            }
            for (StreamAppended appended : batch) {
                process(appended);
            }
            processed += batch.size();
        }
        lastDrainAt = clock.instant();
        return processed;
    }

    /**
     * Folds stored events past the checkpoint in sequence order and notifies listeners.
     *
     * Events the channel already delivered are skipped by the projections. The checkpoint
     * only moves past events that folded without failure and are older than the settle
     * delay, so an append that committed late with a lower sequence is read again next time.
     *
     * @return number of events read
     */
    public synchronized int catchUp() {
        long checkpoint = store.checkpoint();
        Instant settledBefore = clock.instant().minusMillis(catchUpSettleMillis);
        int limit = Math.max(batchSize, 1);
        int read = 0;

        while (true) {
            List<StoredEvent> events = eventStore.readAfter(checkpoint, limit);
            if (events.isEmpty()) {
                break;
            }
            read += events.size();

            ProjectionRun run = fold(events);
            ProjectionChangeSet changes = run.persist(store);
            if (!changes.isEmpty()) {
                log.info("Catch-up projected {} document change(s) from sequences {}..{}", changes.size(),
                        events.get(0).getSequence(), events.get(events.size() - 1).getSequence());
                notifyListeners(changes);
            }

            long reached = run.settledSequence(events, checkpoint, settledBefore);
            if (reached > checkpoint) {
                store.saveCheckpoint(reached);
            }
            if (reached != events.get(events.size() - 1).getSequence() || events.size() < limit) {
                if (run.hasFailures()) {
                    log.warn("Projection checkpoint held at sequence {}: {} document(s) failed to fold",
                            reached, run.failedCount());
                }
                break;
            }
            checkpoint = reached;
        }
        return read;
    }

    /**
     * Folds already stored events without notifying listeners. Used by rebuilds.
     *
     * @return number of documents written
     */
    public synchronized int replay(List<StoredEvent> events) {
        ProjectionRun run = fold(events);
        ProjectionChangeSet changes = run.persist(store);
        if (run.hasFailures()) {
            log.error("Replay left {} document(s) at their last good state", run.failedCount());
        }
        return changes.size();
    }

    public int backlog() {
        return channel.size();
    }

    public long deadLetteredCount() {
        return deadLettered.get();
    }

    public Instant lastDrainAt() {
        return lastDrainAt;
    }

    public long checkpoint() {
        return store.checkpoint();
    }

    private void process(StreamAppended appended) {
        MDC.put(CorrelationContext.STREAM_ID_MDC_KEY, appended.getStreamId().toString());
        try {
            ProjectionRun run = fold(appended.getEvents());
            ProjectionChangeSet changes = run.persist(store);

            if (!changes.isEmpty()) {
                log.debug("Projected {} stream {}: inserted={}, updated={}, deleted={}",
                        appended.getStreamType(), appended.getStreamId(),
                        changes.getInserted().size(), changes.getUpdated().size(), changes.getDeleted().size());
                notifyListeners(changes);
            }

            if (run.hasFailures()) {
                retryOrDeadLetter(appended);
            }
        } catch (Exception e) {
            log.error("Failed to persist projections for {} stream {}: {}",
                    appended.getStreamType(), appended.getStreamId(), e.getMessage(), e);
            retryOrDeadLetter(appended);
        } finally {
            MDC.remove(CorrelationContext.STREAM_ID_MDC_KEY);
        }
    }

    private void notifyListeners(ProjectionChangeSet changes) {
        for (ProjectionCommitListener listener : listeners) {
            try {
                listener.afterCommit(changes);
            } catch (Exception e) {
                log.error("Commit listener {} failed: {}", listener.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }

    private void retryOrDeadLetter(StreamAppended appended) {
        if (appended.getAttempt() >= maxRetries) {
            deadLettered.incrementAndGet();
            metrics.recordDeadLettered(appended.getStreamType());
            log.error("Dead-lettered projection batch, left to catch-up: streamType={}, streamId={}, events={}, attempts={}",
                    appended.getStreamType(), appended.getStreamId(), appended.getEvents().size(),
                    appended.getAttempt() + 1);
            return;
        }
        channel.publish(appended.nextAttempt());
    }

    private ProjectionRun fold(List<StoredEvent> events) {
        ProjectionRun run = new ProjectionRun();
        for (StoredEvent event : events) {
            ProjectionLookup before = run.lookup(store);
            List<Target<?>> targets = new ArrayList<>();
            for (Projection<?> projection : projections) {
                collectTargets(run, targets, projection, event, before);
            }
            for (Target<?> target : targets) {
                foldOne(run, target, event);
            }
        }
        return run;
    }

    private <D extends ProjectionDocument> void collectTargets(ProjectionRun run, List<Target<?>> targets,
                                                               Projection<D> projection, StoredEvent event,
                                                               ProjectionLookup lookup) {
        try {
            Set<UUID> documentIds = projection.identify(event, lookup);
            for (UUID documentId : documentIds) {
                targets.add(new Target<>(projection, documentId));
            }
        } catch (Exception e) {
            run.identifyFailed(event);
            metrics.recordFold(projection.documentType().getSimpleName(), false);
            log.error("Routing failed: documentType={}, eventType={}, sequence={}, error={}",
                    projection.documentType().getSimpleName(), event.getEventType(), event.getSequence(),
                    e.getMessage());
        }
    }

    private <D extends ProjectionDocument> void foldOne(ProjectionRun run, Target<D> target, StoredEvent event) {
        Projection<D> projection = target.projection();
        UUID documentId = target.documentId();

        DocumentKey key = new DocumentKey(projection.documentType(), documentId);
        WorkingDocument working = run.documents.computeIfAbsent(key,
                k -> new WorkingDocument(store.find(projection.documentType(), documentId).orElse(null)));
        if (working.failed) {
            return;
        }

        String documentType = projection.documentType().getSimpleName();
        try {
            D current = projection.documentType().cast(working.current);
            working.current = projection.fold(documentId, current, event, run.lookup(store));
            metrics.recordFold(documentType, true);
        } catch (Exception e) {
            working.failed = true;
            run.failedAt(event);
            metrics.recordFold(documentType, false);
            log.error("Fold failed: documentType={}, documentId={}, eventType={}, version={}, error={}",
                    documentType, documentId, event.getEventType(), event.getVersion(), e.getMessage());
        }
    }

    private record Target<D extends ProjectionDocument>(Projection<D> projection, UUID documentId) {
    }

    private record DocumentKey(Class<? extends ProjectionDocument> type, UUID id) {
    }

    private static final class WorkingDocument {
        private final ProjectionDocument original;
        private ProjectionDocument current;
        private boolean failed;

        private WorkingDocument(ProjectionDocument original) {
            this.original = original;
            this.current = original;
        }
    }

    /**
     * Documents touched by one run, in first-touched order.
     */
    private static final class ProjectionRun {
        private final Map<DocumentKey, WorkingDocument> documents = new LinkedHashMap<>();
        private long firstFailedSequence = Long.MAX_VALUE;
        private int routingFailures;

        void failedAt(StoredEvent event) {
            firstFailedSequence = Math.min(firstFailedSequence, event.getSequence());
        }

        void identifyFailed(StoredEvent event) {
            routingFailures++;
            failedAt(event);
        }

        /**
         * Last sequence of the contiguous prefix of {@code events} that folded everywhere
         * and was stored before {@code settledBefore}; {@code from} if there is none.
         */
        long settledSequence(List<StoredEvent> events, long from, Instant settledBefore) {
            long reached = from;
            for (StoredEvent event : events) {
                if (event.getSequence() >= firstFailedSequence || event.getTimestamp().isAfter(settledBefore)) {
                    break;
                }
                reached = event.getSequence();
            }
            return reached;
        }

        /**
         * Lookups see documents folded earlier in the same run before the store.
         */
        ProjectionLookup lookup(ProjectionStore store) {
            return new ProjectionLookup() {
                @Override
                public <D extends ProjectionDocument> Optional<D> find(Class<D> type, UUID id) {
                    WorkingDocument working = documents.get(new DocumentKey(type, id));
                    if (working != null) {
                        return Optional.ofNullable(working.current).map(type::cast);
                    }
                    return store.find(type, id);
                }
            };
        }

        boolean hasFailures() {
            return failedCount() > 0;
        }

        long failedCount() {
            return routingFailures + documents.values().stream().filter(w -> w.failed).count();
        }

        /**
         * Writes every successfully folded, changed document and classifies it.
         */
        ProjectionChangeSet persist(ProjectionStore store) {
            List<ProjectionDocument> inserted = new ArrayList<>();
            List<ProjectionDocument> updated = new ArrayList<>();
            List<ProjectionDocument> deleted = new ArrayList<>();

            for (Map.Entry<DocumentKey, WorkingDocument> entry : documents.entrySet()) {
                WorkingDocument working = entry.getValue();
                if (working.failed || working.current == working.original) {
                    continue;
                }
                if (working.current == null) {
                    store.delete(entry.getKey().type(), entry.getKey().id());
                    deleted.add(working.original);
                } else if (working.original == null) {
                    store.save(working.current);
                    inserted.add(working.current);
                } else {
                    store.save(working.current);
                    updated.add(working.current);
                }
            }
            return ProjectionChangeSet.of(inserted, updated, deleted);
        }
    }
}
