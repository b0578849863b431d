package com.flagship.bookstore.catalog.user;

import com.flagship.bookstore.catalog.CommandResult;
import com.flagship.bookstore.catalog.user.dto.UserProfileResponse;
import com.flagship.bookstore.web.ConditionalRequestSupport;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * User profile endpoints.
 *
 * Favorites writes accept If-Match against the profile version. The first favorite creates the profile.
 */
@RestController
@RequestMapping("/api/users/{userId}")
@RequiredArgsConstructor
public class UserProfileController {

    private final UserProfileQueryService queryService;
    private final FavoritesCommandService favorites;
    private final ConditionalRequestSupport conditionalRequests;

    @GetMapping("/profile")
    public ResponseEntity<UserProfileResponse> getProfile(
            @PathVariable("userId") UUID userId,
            @RequestHeader(name = HttpHeaders.IF_NONE_MATCH, required = false) String ifNoneMatch) {
        UserProfileResponse profile = queryService.get(userId, false);
        return conditionalRequests.conditionalGet(profile.getVersion(), ifNoneMatch, () -> profile);
    }

    @PostMapping("/favorites/{bookId}")
    public ResponseEntity<Void> addFavorite(
            @PathVariable("userId") UUID userId,
            @PathVariable("bookId") UUID bookId,
            @RequestHeader(name = HttpHeaders.IF_MATCH, required = false) String ifMatch) {
        CommandResult result = favorites.addFavorite(userId, bookId, conditionalRequests.expectedVersion(ifMatch));
        return ResponseEntity.noContent()
                .headers(conditionalRequests.etagHeaders(result.getVersion()))
                .build();
    }

    @DeleteMapping("/favorites/{bookId}")
    public ResponseEntity<Void> removeFavorite(
            @PathVariable("userId") UUID userId,
            @PathVariable("bookId") UUID bookId,
            @RequestHeader(name = HttpHeaders.IF_MATCH, required = false) String ifMatch) {
        CommandResult result = favorites.removeFavorite(userId, bookId, conditionalRequests.expectedVersion(ifMatch));
        return ResponseEntity.noContent()
                .headers(conditionalRequests.etagHeaders(result.getVersion()))
                .build();
    }
}
