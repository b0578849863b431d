package com.flagship.bookstore.eventstore;

import com.flagship.bookstore.domain.DomainEvent;
import com.flagship.bookstore.domain.author.AuthorAdded;
import com.flagship.bookstore.domain.author.AuthorRestored;
import com.flagship.bookstore.domain.author.AuthorSoftDeleted;
import com.flagship.bookstore.domain.author.AuthorUpdated;
import com.flagship.bookstore.domain.book.BookAdded;
import com.flagship.bookstore.domain.book.BookCoverUpdated;
import com.flagship.bookstore.domain.book.BookRestored;
import com.flagship.bookstore.domain.book.BookSaleCancelled;
import com.flagship.bookstore.domain.book.BookSaleScheduled;
import com.flagship.bookstore.domain.book.BookSoftDeleted;
import com.flagship.bookstore.domain.book.BookUpdated;
import com.flagship.bookstore.domain.category.CategoryAdded;
import com.flagship.bookstore.domain.category.CategoryRestored;
import com.flagship.bookstore.domain.category.CategorySoftDeleted;
import com.flagship.bookstore.domain.category.CategoryUpdated;
import com.flagship.bookstore.domain.publisher.PublisherAdded;
import com.flagship.bookstore.domain.publisher.PublisherRestored;
import com.flagship.bookstore.domain.publisher.PublisherSoftDeleted;
import com.flagship.bookstore.domain.publisher.PublisherUpdated;
import com.flagship.bookstore.domain.tenant.TenantCreated;
import com.flagship.bookstore.domain.tenant.TenantUpdated;
import com.flagship.bookstore.domain.user.BookAddedToFavorites;
import com.flagship.bookstore.domain.user.BookRemovedFromFavorites;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps stored event type names to their Java classes for deserialization.
 */
@Component
public class EventTypeRegistry {

    private final Map<String, Class<? extends DomainEvent>> types = new ConcurrentHashMap<>();

    public EventTypeRegistry() {
        register(BookAdded.EVENT_TYPE, BookAdded.class);
        register(BookUpdated.EVENT_TYPE, BookUpdated.class);
        register(BookSoftDeleted.EVENT_TYPE, BookSoftDeleted.class);
        register(BookRestored.EVENT_TYPE, BookRestored.class);
        register(BookCoverUpdated.EVENT_TYPE, BookCoverUpdated.class);
        register(BookSaleScheduled.EVENT_TYPE, BookSaleScheduled.class);
        register(BookSaleCancelled.EVENT_TYPE, BookSaleCancelled.class);
        register(AuthorAdded.EVENT_TYPE, AuthorAdded.class);
        register(AuthorUpdated.EVENT_TYPE, AuthorUpdated.class);
        register(AuthorSoftDeleted.EVENT_TYPE, AuthorSoftDeleted.class);
        register(AuthorRestored.EVENT_TYPE, AuthorRestored.class);
        register(CategoryAdded.EVENT_TYPE, CategoryAdded.class);
        register(CategoryUpdated.EVENT_TYPE, CategoryUpdated.class);
        register(CategorySoftDeleted.EVENT_TYPE, CategorySoftDeleted.class);
        register(CategoryRestored.EVENT_TYPE, CategoryRestored.class);
        register(PublisherAdded.EVENT_TYPE, PublisherAdded.class);
        register(PublisherUpdated.EVENT_TYPE, PublisherUpdated.class);
        register(PublisherSoftDeleted.EVENT_TYPE, PublisherSoftDeleted.class);
        register(PublisherRestored.EVENT_TYPE, PublisherRestored.class);
        register(BookAddedToFavorites.EVENT_TYPE, BookAddedToFavorites.class);
        register(BookRemovedFromFavorites.EVENT_TYPE, BookRemovedFromFavorites.class);
        register(TenantCreated.EVENT_TYPE, TenantCreated.class);
        register(TenantUpdated.EVENT_TYPE, TenantUpdated.class);
    }

    public void register(String eventType, Class<? extends DomainEvent> type) {
        Class<? extends DomainEvent> existing = types.putIfAbsent(eventType, type);
        if (existing != null && existing != type) {
            throw new IllegalStateException(String.format(
                    "Event type %s is already registered to %s", eventType, existing.getName()));
        }
    }

    /**
     * @throws IllegalArgumentException if the name is not registered
     */
    public Class<? extends DomainEvent> resolve(String eventType) {
        Class<? extends DomainEvent> type = types.get(eventType);
        if (type == null) {
            throw new IllegalArgumentException("Unknown event type: " + eventType);
        }
        return type;
    }
}
