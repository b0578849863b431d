package com.flagship.bookstore.catalog.user;

import com.flagship.bookstore.catalog.AggregateCommandExecutor;
import com.flagship.bookstore.catalog.CommandResult;
import com.flagship.bookstore.catalog.book.BookQueryService;
import com.flagship.bookstore.domain.user.UserProfile;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.UUID;

@Service
@RequiredArgsConstructor
public class FavoritesCommandService {

    private final AggregateCommandExecutor executor;
    private final BookQueryService books;

    /**
     * Adds a book to the user's favorites, starting the profile stream on the first one.
     *
     * @throws com.flagship.bookstore.domain.EntityNotFoundException if the book is unknown or deleted
     */
    public CommandResult addFavorite(UUID userId, UUID bookId, Long expectedVersion) {
        books.get(bookId, false);
        return executor.upsert(UserProfile.TYPE, userId, expectedVersion, profile -> profile.addFavorite(bookId));
    }

    public CommandResult removeFavorite(UUID userId, UUID bookId, Long expectedVersion) {
        return executor.execute(UserProfile.TYPE, userId, expectedVersion, profile -> profile.removeFavorite(bookId));
    }
}
