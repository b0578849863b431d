package com.flagship.bookstore.catalog;

import com.flagship.bookstore.domain.EntityNotFoundException;
import com.flagship.bookstore.domain.publisher.Publisher;
import com.flagship.bookstore.domain.user.UserProfile;
import com.flagship.bookstore.eventstore.InMemoryEventStore;
import com.flagship.bookstore.eventstore.VersionConflictException;
import com.flagship.bookstore.projection.ProjectionChannel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class AggregateCommandExecutorTest {

    private InMemoryEventStore eventStore;
    private AggregateCommandExecutor executor;
    private final UUID publisherId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        eventStore = new InMemoryEventStore(new ProjectionChannel(), Clock.systemUTC());
        executor = new AggregateCommandExecutor(eventStore);
    }

    @Test
    @DisplayName("Commands on a missing stream are not found")
    void executeOnMissingStreamFails() {
        assertThrows(EntityNotFoundException.class,
                () -> executor.execute(Publisher.TYPE, publisherId, null, p -> p.update("Tor")));
    }

    @Test
    @DisplayName("A stale expected version is rejected before the command runs")
    void staleVersionRejectedBeforeCommand() {
        executor.start(Publisher.TYPE, publisherId, Publisher.create(publisherId, "Tor"));
        AtomicBoolean ran = new AtomicBoolean();

        VersionConflictException conflict = assertThrows(VersionConflictException.class,
                () -> executor.execute(Publisher.TYPE, publisherId, 3L, p -> {
                    ran.set(true);
                    return p.update("Tor Books");
                }));

        assertFalse(ran.get());
        assertEquals(1L, conflict.getActualVersion());
    }

    @Test
    @DisplayName("Unconditional and matching writes append at the loaded version")
    void writesAppendAtLoadedVersion() {
        executor.start(Publisher.TYPE, publisherId, Publisher.create(publisherId, "Tor"));

        assertEquals(2, executor.execute(Publisher.TYPE, publisherId, 1L, p -> p.update("Tor Books")).getVersion());
        assertEquals(3, executor.execute(Publisher.TYPE, publisherId, null, p -> p.update("Tor")).getVersion());
    }

    @Test
    @DisplayName("Upsert starts a stream that has no creation event")
    void upsertStartsStream() {
        UUID userId = UUID.randomUUID();
        UUID bookId = UUID.randomUUID();

        CommandResult result = executor.upsert(UserProfile.TYPE, userId, null, p -> p.addFavorite(bookId));

        assertEquals(userId, result.getId());
        assertEquals(1, result.getVersion());
        assertTrue(eventStore.load(UserProfile.TYPE, userId).orElseThrow().getFavoriteBookIds().contains(bookId));
    }
}
