package com.flagship.bookstore.projection.catalog;

import com.flagship.bookstore.domain.DomainEvent;
import com.flagship.bookstore.domain.user.BookAddedToFavorites;
import com.flagship.bookstore.domain.user.BookRemovedFromFavorites;
import com.flagship.bookstore.domain.user.UserProfile;
import com.flagship.bookstore.eventstore.StoredEvent;
import com.flagship.bookstore.projection.ProjectionLookup;
import com.flagship.bookstore.projection.SingleStreamProjection;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Favorites per user. The profile stream has no creation event, so the first
 * favorite creates the document.
 */
@Component
public class UserProfileProjection extends SingleStreamProjection<UserProfileDocument> {

    public UserProfileProjection() {
        super(UserProfile.TYPE.getName());
    }

    @Override
    public Class<UserProfileDocument> documentType() {
        return UserProfileDocument.class;
    }

    @Override
    protected UserProfileDocument apply(UserProfileDocument current, StoredEvent event, ProjectionLookup lookup) {
        UserProfileDocument base = current != null ? current : UserProfileDocument.builder()
                .id(event.getStreamId())
                .favoriteBookIds(Set.of())
                .build();

        Set<UUID> favorites = new LinkedHashSet<>(base.getFavoriteBookIds());
        DomainEvent data = event.getData();
        if (data instanceof BookAddedToFavorites added) {
            favorites.add(added.getBookId());
        } else if (data instanceof BookRemovedFromFavorites removed) {
            favorites.remove(removed.getBookId());
        } else {
            throw unsupported(event);
        }

        return base.toBuilder()
                .version(event.getVersion())
                .lastModified(event.getTimestamp())
                .favoriteBookIds(favorites)
                .build();
    }
}
