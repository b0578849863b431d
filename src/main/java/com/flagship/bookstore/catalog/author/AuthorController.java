package com.flagship.bookstore.catalog.author;

import com.flagship.bookstore.catalog.CommandResult;
import com.flagship.bookstore.catalog.ListQuery;
import com.flagship.bookstore.catalog.PagedResponse;
import com.flagship.bookstore.catalog.author.dto.AuthorRequest;
import com.flagship.bookstore.catalog.author.dto.AuthorResponse;
import com.flagship.bookstore.web.ConditionalRequestSupport;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;
import java.util.UUID;

/**
 * Public author reads under {@code /api/authors}, writes under {@code /api/admin/authors}.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class AuthorController {

    private final AuthorQueryService queryService;
    private final AuthorCommandService commandService;
    private final ConditionalRequestSupport conditionalRequests;

    @GetMapping("/authors")
    public ResponseEntity<PagedResponse<AuthorResponse>> listAuthors(
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size,
            @RequestParam(name = "search", required = false) String search,
            @RequestParam(name = "sort", required = false) String sort,
            @RequestParam(name = "includeDeleted", defaultValue = "false") boolean includeDeleted) {
        ListQuery query = ListQuery.builder()
                .page(page)
                .size(size)
                .search(search)
                .sort(sort)
                .includeDeleted(includeDeleted)
                .build();
        return ResponseEntity.ok(queryService.list(query));
    }

    @GetMapping("/authors/{id}")
    public ResponseEntity<AuthorResponse> getAuthor(
            @PathVariable("id") UUID id,
            @RequestHeader(name = HttpHeaders.IF_NONE_MATCH, required = false) String ifNoneMatch) {
        AuthorResponse author = queryService.get(id, false);
        return conditionalRequests.conditionalGet(author.getVersion(), author.getStatisticsVersion(), ifNoneMatch,
                () -> author);
    }

    @PostMapping("/admin/authors")
    public ResponseEntity<Void> createAuthor(@Valid @RequestBody AuthorRequest request) {
        CommandResult result = commandService.create(request);
        log.info("Created author {}", result.getId());
        return ResponseEntity.created(URI.create("/api/authors/" + result.getId()))
                .headers(conditionalRequests.etagHeaders(result.getVersion()))
                .build();
    }

    @PutMapping("/admin/authors/{id}")
    public ResponseEntity<Void> updateAuthor(
            @PathVariable("id") UUID id,
            @RequestHeader(name = HttpHeaders.IF_MATCH, required = false) String ifMatch,
            @Valid @RequestBody AuthorRequest request) {
        return noContent(commandService.update(id, conditionalRequests.expectedVersion(ifMatch), request));
    }

    @DeleteMapping("/admin/authors/{id}")
    public ResponseEntity<Void> deleteAuthor(
            @PathVariable("id") UUID id,
            @RequestHeader(name = HttpHeaders.IF_MATCH, required = false) String ifMatch) {
        return noContent(commandService.delete(id, conditionalRequests.expectedVersion(ifMatch)));
    }

    @PostMapping("/admin/authors/{id}/restore")
    public ResponseEntity<Void> restoreAuthor(
            @PathVariable("id") UUID id,
            @RequestHeader(name = HttpHeaders.IF_MATCH, required = false) String ifMatch) {
        return noContent(commandService.restore(id, conditionalRequests.expectedVersion(ifMatch)));
    }

    private ResponseEntity<Void> noContent(CommandResult result) {
        return ResponseEntity.noContent()
                .headers(conditionalRequests.etagHeaders(result.getVersion()))
                .build();
    }
}
