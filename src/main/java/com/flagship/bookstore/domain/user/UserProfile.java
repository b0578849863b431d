package com.flagship.bookstore.domain.user;

import com.flagship.bookstore.domain.Aggregate;
import com.flagship.bookstore.domain.AggregateType;
import com.flagship.bookstore.domain.DomainConflictException;
import com.flagship.bookstore.domain.DomainEvent;
import com.flagship.bookstore.domain.EntityNotFoundException;
import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Per-user profile stream holding favorite books.
 *
 * The stream has no creation event; it starts with the first favorite.
 */
@Value
@Builder(toBuilder = true)
public class UserProfile implements Aggregate<UserProfile> {

    public static final AggregateType<UserProfile> TYPE = new AggregateType<>("UserProfile", UserProfile::empty);

    UUID id;
    long version;
    Set<UUID> favoriteBookIds;

    static UserProfile empty(UUID id) {
        return new UserProfile(id, 0, Set.of());
    }

    public BookAddedToFavorites addFavorite(UUID bookId) {
        if (favoriteBookIds.contains(bookId)) {
            throw new DomainConflictException("Book " + bookId + " is already in favorites");
        }
        return new BookAddedToFavorites(id, bookId);
    }

    public BookRemovedFromFavorites removeFavorite(UUID bookId) {
        if (!favoriteBookIds.contains(bookId)) {
            throw new EntityNotFoundException("Book " + bookId + " is not in favorites");
        }
        return new BookRemovedFromFavorites(id, bookId);
    }

    @Override
    public UserProfile apply(DomainEvent event, long version) {
        Set<UUID> next = new LinkedHashSet<>(favoriteBookIds);
        if (event instanceof BookAddedToFavorites added) {
            next.add(added.getBookId());
        } else if (event instanceof BookRemovedFromFavorites removed) {
            next.remove(removed.getBookId());
        } else {
            throw new IllegalArgumentException("Event " + event.getEventType() + " does not apply to UserProfile");
        }
        return toBuilder().favoriteBookIds(Set.copyOf(next)).version(version).build();
    }
}
