package com.flagship.bookstore;

import com.flagship.bookstore.cache.InMemoryTaggedCache;
import com.flagship.bookstore.catalog.AggregateCommandExecutor;
import com.flagship.bookstore.catalog.CacheSettings;
import com.flagship.bookstore.catalog.CommandResult;
import com.flagship.bookstore.catalog.ListQuery;
import com.flagship.bookstore.catalog.PagedResponse;
import com.flagship.bookstore.catalog.author.AuthorQueryService;
import com.flagship.bookstore.catalog.author.dto.AuthorResponse;
import com.flagship.bookstore.catalog.book.BookCommandService;
import com.flagship.bookstore.catalog.book.BookQueryService;
import com.flagship.bookstore.catalog.book.dto.BookRequest;
import com.flagship.bookstore.catalog.book.dto.BookResponse;
import com.flagship.bookstore.catalog.book.dto.ScheduleSaleRequest;
import com.flagship.bookstore.catalog.user.FavoritesCommandService;
import com.flagship.bookstore.domain.EntityNotFoundException;
import com.flagship.bookstore.domain.author.Author;
import com.flagship.bookstore.domain.publisher.Publisher;
import com.flagship.bookstore.eventstore.InMemoryEventStore;
import com.flagship.bookstore.eventstore.VersionConflictException;
import com.flagship.bookstore.invalidation.AuthorInvalidationHandler;
import com.flagship.bookstore.invalidation.AuthorStatisticsInvalidationHandler;
import com.flagship.bookstore.invalidation.BookInvalidationHandler;
import com.flagship.bookstore.invalidation.BookStatisticsInvalidationHandler;
import com.flagship.bookstore.invalidation.CategoryInvalidationHandler;
import com.flagship.bookstore.invalidation.CategoryStatisticsInvalidationHandler;
import com.flagship.bookstore.invalidation.InvalidationHandler;
import com.flagship.bookstore.invalidation.InvalidationHandlerRegistry;
import com.flagship.bookstore.invalidation.InvalidationRouter;
import com.flagship.bookstore.invalidation.PublisherInvalidationHandler;
import com.flagship.bookstore.invalidation.PublisherStatisticsInvalidationHandler;
import com.flagship.bookstore.invalidation.TenantInvalidationHandler;
import com.flagship.bookstore.invalidation.UserProfileInvalidationHandler;
import com.flagship.bookstore.notification.DomainNotification;
import com.flagship.bookstore.notification.NotificationPublisher;
import com.flagship.bookstore.observability.PipelineMetrics;
import com.flagship.bookstore.projection.InMemoryProjectionStore;
import com.flagship.bookstore.projection.Projection;
import com.flagship.bookstore.projection.ProjectionChannel;
import com.flagship.bookstore.projection.ProjectionRebuilder;
import com.flagship.bookstore.projection.ProjectionWorker;
import com.flagship.bookstore.projection.catalog.AuthorProjection;
import com.flagship.bookstore.projection.catalog.AuthorStatisticsProjection;
import com.flagship.bookstore.projection.catalog.BookSearchDocument;
import com.flagship.bookstore.projection.catalog.BookSearchProjection;
import com.flagship.bookstore.projection.catalog.BookStatisticsProjection;
import com.flagship.bookstore.projection.catalog.CategoryProjection;
import com.flagship.bookstore.projection.catalog.CategoryStatisticsProjection;
import com.flagship.bookstore.projection.catalog.PublisherProjection;
import com.flagship.bookstore.projection.catalog.PublisherStatisticsProjection;
import com.flagship.bookstore.projection.catalog.TenantProjection;
import com.flagship.bookstore.projection.catalog.UserProfileProjection;
import com.flagship.bookstore.web.ConditionalRequestSupport;
import com.flagship.bookstore.web.ETags;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Write, project, invalidate and read again, wired with the in-memory backends.
 *
 * The projection worker is drained by hand so each step is deterministic.
 */
class CatalogPipelineTest {

    private static final Instant NOW = Instant.parse("2026-08-15T12:00:00Z");

    private final List<DomainNotification> notifications = new CopyOnWriteArrayList<>();

    private ProjectionChannel channel;
    private InMemoryEventStore eventStore;
    private InMemoryProjectionStore projectionStore;
    private InMemoryTaggedCache cache;
    private ProjectionWorker worker;
    private ProjectionRebuilder rebuilder;
    private AggregateCommandExecutor executor;
    private BookCommandService bookCommands;
    private BookQueryService bookQueries;
    private FavoritesCommandService favorites;
    private AuthorQueryService authorQueries;
    private ConditionalRequestSupport conditionalRequests;

    private UUID publisherId;
    private UUID authorId;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        channel = new ProjectionChannel();
        PipelineMetrics metrics = new PipelineMetrics(new SimpleMeterRegistry(), channel);
        NotificationPublisher publisher = new NotificationPublisher() {
            @Override
            public void publish(DomainNotification notification) {
                notifications.add(notification);
            }

            @Override
            public String transport() {
                return "test";
            }
        };

        eventStore = new InMemoryEventStore(channel, clock);
        projectionStore = new InMemoryProjectionStore();
        cache = new InMemoryTaggedCache(clock);

        List<Projection<?>> projections = List.of(
                new BookSearchProjection(), new AuthorProjection(), new CategoryProjection(),
                new PublisherProjection(), new UserProfileProjection(), new TenantProjection(),
                new BookStatisticsProjection(), new AuthorStatisticsProjection(),
                new CategoryStatisticsProjection(), new PublisherStatisticsProjection());
        List<InvalidationHandler<?>> handlers = List.of(
                new BookInvalidationHandler(cache, publisher, metrics, clock, projectionStore),
                new AuthorInvalidationHandler(cache, publisher, metrics, clock, projectionStore),
                new CategoryInvalidationHandler(cache, publisher, metrics, clock, projectionStore),
                new PublisherInvalidationHandler(cache, publisher, metrics, clock, projectionStore),
                new UserProfileInvalidationHandler(cache, publisher, metrics, clock),
                new TenantInvalidationHandler(cache, publisher, metrics, clock),
                new BookStatisticsInvalidationHandler(cache, publisher, metrics, clock, projectionStore),
                new AuthorStatisticsInvalidationHandler(cache, publisher, metrics, clock, projectionStore),
                new CategoryStatisticsInvalidationHandler(cache, publisher, metrics, clock, projectionStore),
                new PublisherStatisticsInvalidationHandler(cache, publisher, metrics, clock, projectionStore));
        InvalidationHandlerRegistry registry = new InvalidationHandlerRegistry(handlers, projections, true);
        registry.verifyCompleteness();

        worker = new ProjectionWorker(channel, projectionStore, eventStore, projections,
                List.of(new InvalidationRouter(registry, metrics)), metrics, Clock.offset(clock, Duration.ofMinutes(1)));
        ReflectionTestUtils.setField(worker, "maxRetries", 3);
        ReflectionTestUtils.setField(worker, "batchSize", 50);
        ReflectionTestUtils.setField(worker, "catchUpSettleMillis", 5000L);
        rebuilder = new ProjectionRebuilder(eventStore, projectionStore, worker, cache);
        ReflectionTestUtils.setField(rebuilder, "pageSize", 2);

        executor = new AggregateCommandExecutor(eventStore);
        bookCommands = new BookCommandService(executor, clock);
        CacheSettings cacheSettings = new CacheSettings(Duration.ofMinutes(10), Duration.ofMinutes(2));
        bookQueries = new BookQueryService(projectionStore, cache, cacheSettings, clock);
        authorQueries = new AuthorQueryService(projectionStore, cache, cacheSettings);
        conditionalRequests = new ConditionalRequestSupport(false);
        favorites = new FavoritesCommandService(executor, bookQueries);

        publisherId = UUID.randomUUID();
        authorId = UUID.randomUUID();
        executor.start(Publisher.TYPE, publisherId, Publisher.create(publisherId, "Houghton Mifflin"));
        executor.start(Author.TYPE, authorId, Author.create(authorId, "Ursula K. Le Guin", Map.of()));
        worker.drain();
        notifications.clear();
    }

    private BookRequest request(String title) {
        return new BookRequest(title, "9780547773742", "en", null, null, publisherId,
                List.of(authorId), null, Map.of("USD", new BigDecimal("20.00")));
    }

    private List<String> notifiedEventTypes() {
        List<String> types = new ArrayList<>();
        notifications.forEach(n -> types.add(n.getEventType()));
        return types;
    }

    private List<String> notifiedBookEventTypes() {
        List<String> types = new ArrayList<>();
        notifications.stream().filter(n -> "Book".equals(n.getEntityType())).forEach(n -> types.add(n.getEventType()));
        return types;
    }

    private String lastBookEventType() {
        List<String> types = notifiedBookEventTypes();
        return types.get(types.size() - 1);
    }

    @Test
    @DisplayName("A created book becomes readable after projection with denormalized names")
    void createdBookIsProjected() {
        CommandResult created = bookCommands.create(request("A Wizard of Earthsea"));
        assertEquals(1, created.getVersion());
        assertThrows(EntityNotFoundException.class, () -> bookQueries.get(created.getId(), false));

        worker.drain();

        BookResponse book = bookQueries.get(created.getId(), false);
        assertEquals("A Wizard of Earthsea", book.getTitle());
        assertEquals("Houghton Mifflin", book.getPublisherName());
        assertEquals("Ursula K. Le Guin", book.getAuthorNames());
        assertEquals(1, book.getVersion());
        assertEquals(List.of("BookCreated"), notifiedBookEventTypes());
        assertTrue(notifiedEventTypes().containsAll(List.of("AuthorUpdated", "PublisherUpdated")));
    }

    @Test
    @DisplayName("An update evicts the cached item and list so readers see the new version")
    void updateInvalidatesCachedReads() {
        UUID bookId = bookCommands.create(request("A Wizard of Earthsea")).getId();
        worker.drain();

        ListQuery search = ListQuery.builder().page(0).size(10).search("earthsea").build();
        assertEquals(1, bookQueries.get(bookId, false).getVersion());
        assertEquals(1, bookQueries.list(search).getTotalItems());

        bookCommands.update(bookId, 1L, request("The Tombs of Atuan"));
        assertEquals("A Wizard of Earthsea", bookQueries.get(bookId, false).getTitle());

        worker.drain();

        BookResponse updated = bookQueries.get(bookId, false);
        assertEquals("The Tombs of Atuan", updated.getTitle());
        assertEquals(2, updated.getVersion());
        assertEquals(0, bookQueries.list(search).getTotalItems());
        assertEquals(List.of("BookCreated", "BookUpdated"), notifiedBookEventTypes());
    }

    @Test
    @DisplayName("A write at a stale version is rejected and appends nothing")
    void staleWriteIsRejected() {
        UUID bookId = bookCommands.create(request("A Wizard of Earthsea")).getId();
        bookCommands.update(bookId, 1L, request("The Tombs of Atuan"));

        assertThrows(VersionConflictException.class,
                () -> bookCommands.update(bookId, 1L, request("The Farthest Shore")));
        assertEquals(2, eventStore.streamVersion(bookId));
    }

    @Test
    @DisplayName("Soft delete hides the book from readers and is announced as a deletion")
    void softDeleteHidesBook() {
        UUID bookId = bookCommands.create(request("A Wizard of Earthsea")).getId();
        worker.drain();
        bookQueries.get(bookId, false);

        bookCommands.delete(bookId, 1L);
        worker.drain();

        assertThrows(EntityNotFoundException.class, () -> bookQueries.get(bookId, false));
        assertTrue(bookQueries.get(bookId, true).isDeleted());
        assertEquals("BookDeleted", lastBookEventType());

        bookCommands.restore(bookId, 2L);
        worker.drain();
        assertFalse(bookQueries.get(bookId, false).isDeleted());
        assertEquals("BookUpdated", lastBookEventType());
    }

    @Test
    @DisplayName("Favoriting a book updates its like count and refreshes the cached book")
    void favoriteUpdatesLikeCount() {
        UUID bookId = bookCommands.create(request("A Wizard of Earthsea")).getId();
        worker.drain();
        assertEquals(0, bookQueries.get(bookId, false).getLikeCount());

        UUID userId = UUID.randomUUID();
        CommandResult liked = favorites.addFavorite(userId, bookId, null);
        assertEquals(1, liked.getVersion());
        worker.drain();

        assertEquals(1, bookQueries.get(bookId, false).getLikeCount());
        assertTrue(notifiedEventTypes().containsAll(List.of("UserUpdated", "BookUpdated")));
        assertTrue(notifications.stream().anyMatch(n -> "Statistics Updated".equals(n.getName())));

        assertThrows(EntityNotFoundException.class, () -> favorites.addFavorite(userId, UUID.randomUUID(), null));
    }

    @Test
    @DisplayName("A favorite changes the book's ETag, so a conditional read with the old tag gets the new count")
    void favoriteChangesBookETag() {
        UUID bookId = bookCommands.create(request("A Wizard of Earthsea")).getId();
        worker.drain();
        BookResponse before = bookQueries.get(bookId, false);
        String oldETag = conditionalRequests.conditionalGet(before.getVersion(), before.getStatisticsVersion(),
                null, () -> before).getHeaders().getETag();
        assertEquals("\"1\"", oldETag);
        notifications.clear();

        favorites.addFavorite(UUID.randomUUID(), bookId, null);
        worker.drain();

        BookResponse after = bookQueries.get(bookId, false);
        ResponseEntity<BookResponse> response = conditionalRequests.conditionalGet(after.getVersion(),
                after.getStatisticsVersion(), oldETag, () -> after);

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals(1, response.getBody().getLikeCount());
        String newETag = response.getHeaders().getETag();
        assertNotEquals(oldETag, newETag);
        assertEquals(1L, ETags.parse(newETag));

        DomainNotification bookNotification = notifications.stream()
                .filter(n -> "BookUpdated".equals(n.getEventType()))
                .findFirst().orElseThrow();
        assertEquals(newETag, bookNotification.getEtag());
        assertEquals(1, bookNotification.getVersion());

        assertEquals(HttpStatus.NOT_MODIFIED, conditionalRequests.conditionalGet(after.getVersion(),
                after.getStatisticsVersion(), newETag, () -> after).getStatusCode());
    }

    @Test
    @DisplayName("Author reads carry the number of live books and refresh when it changes")
    void authorBookCountFollowsBooks() {
        assertEquals(0, authorQueries.get(authorId, false).getBookCount());

        UUID bookId = bookCommands.create(request("A Wizard of Earthsea")).getId();
        worker.drain();
        AuthorResponse author = authorQueries.get(authorId, false);
        assertEquals(1, author.getBookCount());
        assertEquals(1, author.getStatisticsVersion());
        assertTrue(notifications.stream().anyMatch(n -> "AuthorUpdated".equals(n.getEventType())
                && "\"1.1\"".equals(n.getEtag())));

        bookCommands.delete(bookId, 1L);
        worker.drain();
        assertEquals(0, authorQueries.get(authorId, false).getBookCount());
    }

    @Test
    @DisplayName("Events whose queue messages were dropped still reach readers through catch-up")
    void catchUpRecoversDroppedMessages() {
        UUID bookId = bookCommands.create(request("A Wizard of Earthsea")).getId();
        channel.take(channel.size());

        assertEquals(0, worker.drain());
        assertThrows(EntityNotFoundException.class, () -> bookQueries.get(bookId, false));

        worker.catchUp();

        assertEquals("A Wizard of Earthsea", bookQueries.get(bookId, false).getTitle());
        assertEquals(1, authorQueries.get(authorId, false).getBookCount());
        assertTrue(notifiedEventTypes().contains("BookCreated"));
        assertEquals(eventStore.readAfter(0, 100).size(), worker.checkpoint());
    }

    @Test
    @DisplayName("Current prices apply the sale active at read time")
    void activeSaleDiscountsPrices() {
        UUID bookId = bookCommands.create(request("A Wizard of Earthsea")).getId();
        bookCommands.scheduleSale(bookId, 1L, new ScheduleSaleRequest(new BigDecimal("25"),
                NOW.minusSeconds(3600), NOW.plusSeconds(3600)));
        worker.drain();

        BookResponse book = bookQueries.get(bookId, false);
        assertEquals(new BigDecimal("20.00"), book.getPrices().get("USD"));
        assertEquals(new BigDecimal("15.00"), book.getCurrentPrices().get("USD"));
    }

    @Test
    @DisplayName("Rebuilding from the event store reproduces the projected documents")
    void rebuildReproducesDocuments() {
        UUID bookId = bookCommands.create(request("A Wizard of Earthsea")).getId();
        bookCommands.update(bookId, 1L, request("The Tombs of Atuan"));
        worker.drain();
        BookSearchDocument before = projectionStore.find(BookSearchDocument.class, bookId).orElseThrow();

        ProjectionRebuilder.RebuildResult result = rebuilder.rebuild();

        assertEquals(4, result.events());
        BookSearchDocument after = projectionStore.find(BookSearchDocument.class, bookId).orElseThrow();
        assertEquals(before, after);
        PagedResponse<BookResponse> page = bookQueries.list(ListQuery.builder().page(0).size(10).build());
        assertEquals(1, page.getTotalItems());
    }
}
