package com.flagship.bookstore.domain.user;

import com.flagship.bookstore.domain.DomainConflictException;
import com.flagship.bookstore.domain.EntityNotFoundException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class UserProfileTest {

    private final UUID userId = UUID.randomUUID();
    private final UUID bookId = UUID.randomUUID();

    @Test
    @DisplayName("A new profile starts empty at version 0")
    void initialProfileIsEmpty() {
        UserProfile profile = UserProfile.TYPE.initial(userId);

        assertEquals(0, profile.getVersion());
        assertTrue(profile.getFavoriteBookIds().isEmpty());
    }

    @Test
    @DisplayName("Adding the same favorite twice is a conflict")
    void duplicateFavoriteConflicts() {
        UserProfile profile = UserProfile.TYPE.initial(userId);
        UserProfile liked = profile.apply(profile.addFavorite(bookId), 1);

        assertTrue(liked.getFavoriteBookIds().contains(bookId));
        assertThrows(DomainConflictException.class, () -> liked.addFavorite(bookId));
    }

    @Test
    @DisplayName("Removing a favorite that is not there is not found")
    void removingUnknownFavoriteFails() {
        UserProfile profile = UserProfile.TYPE.initial(userId);

        assertThrows(EntityNotFoundException.class, () -> profile.removeFavorite(bookId));

        UserProfile liked = profile.apply(profile.addFavorite(bookId), 1);
        UserProfile unliked = liked.apply(liked.removeFavorite(bookId), 2);
        assertEquals(2, unliked.getVersion());
        assertFalse(unliked.getFavoriteBookIds().contains(bookId));
    }
}
