package com.flagship.bookstore.catalog.book;

import com.flagship.bookstore.catalog.CommandResult;
import com.flagship.bookstore.catalog.book.dto.BookRequest;
import com.flagship.bookstore.catalog.book.dto.CoverRequest;
import com.flagship.bookstore.catalog.book.dto.ScheduleSaleRequest;
import com.flagship.bookstore.web.ConditionalRequestSupport;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;
import java.time.Instant;
import java.util.UUID;

/**
 * Book writes.
 *
 * {@code If-Match} carries the version the client last read; a stale one yields 412.
 * Responses carry the ETag of the new version. The projection catches up asynchronously,
 * so a read right after a write may still return the previous version.
 */
@RestController
@RequestMapping("/api/admin/books")
@RequiredArgsConstructor
@Slf4j
public class BookAdminController {

    private final BookCommandService commandService;
    private final ConditionalRequestSupport conditionalRequests;

    @PostMapping
    public ResponseEntity<Void> createBook(@Valid @RequestBody BookRequest request) {
        log.info("Received book creation request: title={}", request.getTitle());
        CommandResult result = commandService.create(request);
        return ResponseEntity.created(URI.create("/api/books/" + result.getId()))
                .headers(conditionalRequests.etagHeaders(result.getVersion()))
                .build();
    }

    @PutMapping("/{id}")
    public ResponseEntity<Void> updateBook(
            @PathVariable("id") UUID id,
            @RequestHeader(name = HttpHeaders.IF_MATCH, required = false) String ifMatch,
            @Valid @RequestBody BookRequest request) {
        CommandResult result = commandService.update(id, conditionalRequests.expectedVersion(ifMatch), request);
        return noContent(result);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteBook(
            @PathVariable("id") UUID id,
            @RequestHeader(name = HttpHeaders.IF_MATCH, required = false) String ifMatch) {
        return noContent(commandService.delete(id, conditionalRequests.expectedVersion(ifMatch)));
    }

    @PostMapping("/{id}/restore")
    public ResponseEntity<Void> restoreBook(
            @PathVariable("id") UUID id,
            @RequestHeader(name = HttpHeaders.IF_MATCH, required = false) String ifMatch) {
        return noContent(commandService.restore(id, conditionalRequests.expectedVersion(ifMatch)));
    }

    @PutMapping("/{id}/cover")
    public ResponseEntity<Void> updateCover(
            @PathVariable("id") UUID id,
            @RequestHeader(name = HttpHeaders.IF_MATCH, required = false) String ifMatch,
            @Valid @RequestBody CoverRequest request) {
        return noContent(commandService.updateCover(id, conditionalRequests.expectedVersion(ifMatch),
                request.getCoverImageUrl()));
    }

    @PostMapping("/{id}/sales")
    public ResponseEntity<Void> scheduleSale(
            @PathVariable("id") UUID id,
            @RequestHeader(name = HttpHeaders.IF_MATCH, required = false) String ifMatch,
            @Valid @RequestBody ScheduleSaleRequest request) {
        return noContent(commandService.scheduleSale(id, conditionalRequests.expectedVersion(ifMatch), request));
    }

    @DeleteMapping("/{id}/sales")
    public ResponseEntity<Void> cancelSale(
            @PathVariable("id") UUID id,
            @RequestHeader(name = HttpHeaders.IF_MATCH, required = false) String ifMatch,
            @RequestParam("start") Instant start) {
        return noContent(commandService.cancelSale(id, conditionalRequests.expectedVersion(ifMatch), start));
    }

    private ResponseEntity<Void> noContent(CommandResult result) {
        return ResponseEntity.noContent()
                .headers(conditionalRequests.etagHeaders(result.getVersion()))
                .build();
    }
}
