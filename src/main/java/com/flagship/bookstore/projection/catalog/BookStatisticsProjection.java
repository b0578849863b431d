package com.flagship.bookstore.projection.catalog;

import com.flagship.bookstore.domain.DomainEvent;
import com.flagship.bookstore.domain.user.BookAddedToFavorites;
import com.flagship.bookstore.domain.user.BookRemovedFromFavorites;
import com.flagship.bookstore.domain.user.UserProfile;
import com.flagship.bookstore.eventstore.StoredEvent;
import com.flagship.bookstore.projection.Projection;
import com.flagship.bookstore.projection.ProjectionLookup;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Aggregates favorites from every user profile stream into one document per book.
 *
 * Each favorite event states the user's whole position on the book, so the event with
 * the highest stream version per user wins. An event at or below the version recorded
 * for its user is skipped, which makes the fold independent of delivery order: adding,
 * removing and adding again counts once however the three events arrive.
 */
@Component
public class BookStatisticsProjection implements Projection<BookStatisticsDocument> {

    @Override
    public Class<BookStatisticsDocument> documentType() {
        return BookStatisticsDocument.class;
    }

    @Override
    public Set<UUID> identify(StoredEvent event, ProjectionLookup lookup) {
        if (!UserProfile.TYPE.getName().equals(event.getStreamType())) {
            return Set.of();
        }
        UUID bookId = bookIdOf(event.getData());
        return bookId == null ? Set.of() : Set.of(BookStatisticsDocument.idFor(bookId));
    }

    @Override
    public BookStatisticsDocument fold(UUID documentId, BookStatisticsDocument current, StoredEvent event,
                                       ProjectionLookup lookup) {
        UUID bookId = bookIdOf(event.getData());
        BookStatisticsDocument base = current != null ? current : BookStatisticsDocument.builder()
                .id(documentId)
                .bookId(bookId)
                .sourceVersions(Map.of())
                .likedBy(Set.of())
                .build();

        UUID userId = event.getStreamId();
        long latest = base.getSourceVersions().getOrDefault(userId, 0L);
        if (event.getVersion() <= latest) {
            return current;
        }

        Map<UUID, Long> sourceVersions = new HashMap<>(base.getSourceVersions());
        sourceVersions.put(userId, event.getVersion());
        Set<UUID> likedBy = new HashSet<>(base.getLikedBy());
        if (event.getData() instanceof BookAddedToFavorites) {
            likedBy.add(userId);
        } else {
            likedBy.remove(userId);
        }

        return base.toBuilder()
                .version(base.getVersion() + 1)
                .lastModified(event.getTimestamp())
                .likeCount(likedBy.size())
                .sourceVersions(sourceVersions)
                .likedBy(likedBy)
                .build();
    }

    private static UUID bookIdOf(DomainEvent data) {
        if (data instanceof BookAddedToFavorites added) {
            return added.getBookId();
        }
        if (data instanceof BookRemovedFromFavorites removed) {
            return removed.getBookId();
        }
        return null;
    }
}
