package com.flagship.bookstore.projection;

import com.flagship.bookstore.domain.user.BookAddedToFavorites;
import com.flagship.bookstore.eventstore.InMemoryEventStore;
import com.flagship.bookstore.eventstore.StoredEvent;
import com.flagship.bookstore.eventstore.StreamAppended;
import com.flagship.bookstore.observability.PipelineMetrics;
import com.flagship.bookstore.projection.catalog.BookStatisticsDocument;
import com.flagship.bookstore.projection.catalog.BookStatisticsProjection;
import com.flagship.bookstore.projection.catalog.UserProfileDocument;
import com.flagship.bookstore.projection.catalog.UserProfileProjection;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class ProjectionWorkerTest {

    private static final Instant T0 = Instant.parse("2026-05-01T09:00:00Z");
    private static final Instant SETTLED = T0.plusSeconds(60);

    private ProjectionChannel channel;
    private ProjectionChannel unwatchedChannel;
    private InMemoryEventStore eventStore;
    private InMemoryProjectionStore store;
    private SimpleMeterRegistry meterRegistry;
    private FlakyStatisticsProjection statistics;
    private final List<ProjectionChangeSet> committed = new ArrayList<>();
    private ProjectionWorker worker;

    private final UUID userId = UUID.randomUUID();
    private final UUID bookId = UUID.randomUUID();

    /**
     * Fails every fold until its failure budget is used up.
     */
    static class FlakyStatisticsProjection extends BookStatisticsProjection {
        int failuresLeft;

        @Override
        public BookStatisticsDocument fold(UUID documentId, BookStatisticsDocument current, StoredEvent event,
                                           ProjectionLookup lookup) {
            if (failuresLeft > 0) {
                failuresLeft--;
                throw new IllegalStateException("statistics store unavailable");
            }
            return super.fold(documentId, current, event, lookup);
        }
    }

    @BeforeEach
    void setUp() {
        channel = new ProjectionChannel();
        unwatchedChannel = new ProjectionChannel();
        eventStore = new InMemoryEventStore(unwatchedChannel, Clock.fixed(T0, ZoneOffset.UTC));
        store = new InMemoryProjectionStore();
        meterRegistry = new SimpleMeterRegistry();
        statistics = new FlakyStatisticsProjection();
        committed.clear();

        worker = worker(List.of(new UserProfileProjection(), statistics), List.of(committed::add), SETTLED);
    }

    private ProjectionWorker worker(List<Projection<?>> projections, List<ProjectionCommitListener> listeners,
                                    Instant now) {
        ProjectionWorker worker = new ProjectionWorker(channel, store, eventStore, projections, listeners,
                new PipelineMetrics(meterRegistry, channel), Clock.fixed(now, ZoneOffset.UTC));
        ReflectionTestUtils.setField(worker, "maxRetries", 2);
        ReflectionTestUtils.setField(worker, "batchSize", 10);
        ReflectionTestUtils.setField(worker, "catchUpSettleMillis", 5000L);
        return worker;
    }

    /**
     * Stores a favorite whose channel message never reaches the worker.
     */
    private void storeFavoriteOnly(long expectedVersion, UUID favoriteBookId) {
        eventStore.append(userId, "UserProfile", expectedVersion, List.of(new BookAddedToFavorites(userId, favoriteBookId)));
    }

    private void appendFavorite() {
        StoredEvent event = new StoredEvent(UUID.randomUUID(), userId, "UserProfile", 1, 1,
                new BookAddedToFavorites(userId, bookId), T0);
        channel.publish(StreamAppended.of(userId, "UserProfile", List.of(event)));
    }

    @Test
    @DisplayName("Drain folds every projection and reports inserted documents to listeners")
    void drainProjectsAndNotifies() {
        appendFavorite();

        assertEquals(1, worker.drain());

        assertTrue(store.find(UserProfileDocument.class, userId).isPresent());
        BookStatisticsDocument stats = store.find(BookStatisticsDocument.class, BookStatisticsDocument.idFor(bookId))
                .orElseThrow();
        assertEquals(1, stats.getLikeCount());

        assertEquals(1, committed.size());
        assertEquals(2, committed.get(0).getInserted().size());
        assertTrue(channel.isEmpty());
        assertNotNull(worker.lastDrainAt());
    }

    @Test
    @DisplayName("A failing fold keeps other documents, re-queues the batch and skips folded events on retry")
    void failingFoldIsIsolatedAndRetried() {
        statistics.failuresLeft = 1;
        appendFavorite();

        worker.drain();

        assertTrue(store.find(UserProfileDocument.class, userId).isPresent());
        assertTrue(store.find(BookStatisticsDocument.class, BookStatisticsDocument.idFor(bookId)).isEmpty());
        assertEquals(1, committed.size());
        assertEquals(List.of(UserProfileDocument.class),
                committed.get(0).getInserted().stream().map(Object::getClass).toList());
        assertEquals(1, worker.backlog());

        worker.drain();

        assertTrue(store.find(BookStatisticsDocument.class, BookStatisticsDocument.idFor(bookId)).isPresent());
        assertEquals(2, committed.size());
        assertEquals(List.of(BookStatisticsDocument.class),
                committed.get(1).getInserted().stream().map(Object::getClass).toList());
        assertEquals(0, worker.backlog());
        assertEquals(1.0, meterRegistry.counter("projection.folds",
                "document_type", "BookStatisticsDocument", "status", "failure").count());
    }

    @Test
    @DisplayName("A batch that keeps failing is dead-lettered after the configured retries")
    void exhaustedBatchIsDeadLettered() {
        statistics.failuresLeft = Integer.MAX_VALUE;
        appendFavorite();

        worker.drain();
        worker.drain();
        assertEquals(1, worker.backlog());
        assertEquals(0, worker.deadLetteredCount());

        worker.drain();
        assertEquals(0, worker.backlog());
        assertEquals(1, worker.deadLetteredCount());
        assertEquals(1.0, meterRegistry.counter("projection.batches.dead_lettered",
                "stream_type", "UserProfile").count());
    }

    @Test
    @DisplayName("Events whose queue message was lost are projected by catch-up")
    void catchUpProjectsLostMessages() {
        storeFavoriteOnly(0, bookId);

        assertEquals(0, worker.drain());
        assertTrue(store.find(UserProfileDocument.class, userId).isEmpty());

        assertEquals(1, worker.catchUp());

        assertTrue(store.find(UserProfileDocument.class, userId).isPresent());
        assertEquals(1, store.find(BookStatisticsDocument.class, BookStatisticsDocument.idFor(bookId))
                .orElseThrow().getLikeCount());
        assertEquals(1, committed.size());
        assertEquals(1, worker.checkpoint());

        assertEquals(0, worker.catchUp());
        assertEquals(1, committed.size());
    }

    @Test
    @DisplayName("Catch-up reads past the checkpoint in batches and skips events the queue already delivered")
    void catchUpSkipsDeliveredEventsAndPages() {
        ReflectionTestUtils.setField(worker, "batchSize", 2);
        storeFavoriteOnly(0, bookId);
        storeFavoriteOnly(1, UUID.randomUUID());
        storeFavoriteOnly(2, UUID.randomUUID());
        worker.replay(eventStore.readAfter(0, 1));

        assertEquals(3, worker.catchUp());

        assertEquals(3, worker.checkpoint());
        assertEquals(3, store.find(UserProfileDocument.class, userId).orElseThrow().getFavoriteBookIds().size());
        assertEquals(1, store.find(BookStatisticsDocument.class, BookStatisticsDocument.idFor(bookId))
                .orElseThrow().getLikeCount());
    }

    @Test
    @DisplayName("A dead-lettered batch converges through catch-up once the fold recovers")
    void deadLetteredBatchConvergesThroughCatchUp() {
        statistics.failuresLeft = 3;
        storeFavoriteOnly(0, bookId);
        channel.publish(unwatchedChannel.take(1).get(0));

        worker.drain();
        worker.drain();
        worker.drain();
        assertEquals(1, worker.deadLetteredCount());
        assertTrue(store.find(BookStatisticsDocument.class, BookStatisticsDocument.idFor(bookId)).isEmpty());

        worker.catchUp();

        assertEquals(1, store.find(BookStatisticsDocument.class, BookStatisticsDocument.idFor(bookId))
                .orElseThrow().getLikeCount());
        assertEquals(1, worker.checkpoint());
    }

    @Test
    @DisplayName("A failed fold holds the checkpoint so the event is read again")
    void failedFoldHoldsCheckpoint() {
        statistics.failuresLeft = 1;
        storeFavoriteOnly(0, bookId);

        worker.catchUp();

        assertTrue(store.find(UserProfileDocument.class, userId).isPresent());
        assertTrue(store.find(BookStatisticsDocument.class, BookStatisticsDocument.idFor(bookId)).isEmpty());
        assertEquals(0, worker.checkpoint());

        worker.catchUp();

        assertTrue(store.find(BookStatisticsDocument.class, BookStatisticsDocument.idFor(bookId)).isPresent());
        assertEquals(1, worker.checkpoint());
    }

    @Test
    @DisplayName("Recent events are projected but the checkpoint waits for the settle delay")
    void recentEventsHoldCheckpoint() {
        ProjectionWorker early = worker(List.of(new UserProfileProjection(), statistics),
                List.of(committed::add), T0.plusSeconds(1));
        storeFavoriteOnly(0, bookId);

        assertEquals(1, early.catchUp());

        assertTrue(store.find(UserProfileDocument.class, userId).isPresent());
        assertEquals(0, early.checkpoint());

        worker.catchUp();
        assertEquals(1, worker.checkpoint());
        assertEquals(1, committed.size());
    }

    @Test
    @DisplayName("A failing commit listener does not stop the others")
    void listenerFailureIsIsolated() {
        List<ProjectionChangeSet> second = new ArrayList<>();
        worker = worker(List.of(new UserProfileProjection()),
                List.of(changes -> {
                    throw new IllegalStateException("listener down");
                }, second::add), SETTLED);
        appendFavorite();

        worker.drain();

        assertEquals(1, second.size());
        assertTrue(channel.isEmpty());
    }

    @Test
    @DisplayName("Replay writes documents without notifying listeners")
    void replayDoesNotNotify() {
        StoredEvent event = new StoredEvent(UUID.randomUUID(), userId, "UserProfile", 1, 1,
                new BookAddedToFavorites(userId, bookId), T0);

        assertEquals(2, worker.replay(List.of(event)));
        assertTrue(committed.isEmpty());
        assertEquals(0, worker.replay(List.of(event)));
    }
}
