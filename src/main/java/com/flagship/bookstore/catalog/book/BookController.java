package com.flagship.bookstore.catalog.book;

import com.flagship.bookstore.catalog.ListQuery;
import com.flagship.bookstore.catalog.PagedResponse;
import com.flagship.bookstore.catalog.book.dto.BookResponse;
import com.flagship.bookstore.web.ConditionalRequestSupport;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Public book reads, served from the book search projection.
 */
@RestController
@RequestMapping("/api/books")
@RequiredArgsConstructor
public class BookController {

    private final BookQueryService queryService;
    private final ConditionalRequestSupport conditionalRequests;

    @GetMapping
    public ResponseEntity<PagedResponse<BookResponse>> listBooks(
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size,
            @RequestParam(name = "search", required = false) String search,
            @RequestParam(name = "sort", required = false) String sort,
            @RequestParam(name = "includeDeleted", defaultValue = "false") boolean includeDeleted,
            @RequestParam(name = "authorId", required = false) UUID authorId,
            @RequestParam(name = "categoryId", required = false) UUID categoryId,
            @RequestParam(name = "publisherId", required = false) UUID publisherId) {

        ListQuery.ListQueryBuilder query = ListQuery.builder()
                .page(page)
                .size(size)
                .search(search)
                .sort(sort)
                .includeDeleted(includeDeleted);
        if (authorId != null) {
            query.filter(BookQueryService.AUTHOR_FILTER, authorId.toString());
        }
        if (categoryId != null) {
            query.filter(BookQueryService.CATEGORY_FILTER, categoryId.toString());
        }
        if (publisherId != null) {
            query.filter(BookQueryService.PUBLISHER_FILTER, publisherId.toString());
        }
        return ResponseEntity.ok(queryService.list(query.build()));
    }

    /**
     * Returns the book with its ETag, or 304 if {@code If-None-Match} carries the current one.
     */
    @GetMapping("/{id}")
    public ResponseEntity<BookResponse> getBook(
            @PathVariable("id") UUID id,
            @RequestHeader(name = HttpHeaders.IF_NONE_MATCH, required = false) String ifNoneMatch) {
        BookResponse book = queryService.get(id, false);
        return conditionalRequests.conditionalGet(book.getVersion(), book.getStatisticsVersion(), ifNoneMatch,
                () -> book);
    }
}
