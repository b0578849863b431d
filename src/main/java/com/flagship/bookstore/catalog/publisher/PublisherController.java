package com.flagship.bookstore.catalog.publisher;

import com.flagship.bookstore.catalog.CommandResult;
import com.flagship.bookstore.catalog.ListQuery;
import com.flagship.bookstore.catalog.PagedResponse;
import com.flagship.bookstore.catalog.publisher.dto.PublisherRequest;
import com.flagship.bookstore.catalog.publisher.dto.PublisherResponse;
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
 * Public publisher reads under {@code /api/publishers}, writes under {@code /api/admin/publishers}.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class PublisherController {

    private final PublisherQueryService queryService;
    private final PublisherCommandService commandService;
    private final ConditionalRequestSupport conditionalRequests;

    @GetMapping("/publishers")
    public ResponseEntity<PagedResponse<PublisherResponse>> listPublishers(
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

    @GetMapping("/publishers/{id}")
    public ResponseEntity<PublisherResponse> getPublisher(
            @PathVariable("id") UUID id,
            @RequestHeader(name = HttpHeaders.IF_NONE_MATCH, required = false) String ifNoneMatch) {
        PublisherResponse publisher = queryService.get(id, false);
        return conditionalRequests.conditionalGet(publisher.getVersion(), publisher.getStatisticsVersion(), ifNoneMatch,
                () -> publisher);
    }

    @PostMapping("/admin/publishers")
    public ResponseEntity<Void> createPublisher(@Valid @RequestBody PublisherRequest request) {
        CommandResult result = commandService.create(request);
        log.info("Created publisher {}", result.getId());
        return ResponseEntity.created(URI.create("/api/publishers/" + result.getId()))
                .headers(conditionalRequests.etagHeaders(result.getVersion()))
                .build();
    }

    @PutMapping("/admin/publishers/{id}")
    public ResponseEntity<Void> updatePublisher(
            @PathVariable("id") UUID id,
            @RequestHeader(name = HttpHeaders.IF_MATCH, required = false) String ifMatch,
            @Valid @RequestBody PublisherRequest request) {
        return noContent(commandService.update(id, conditionalRequests.expectedVersion(ifMatch), request));
    }

    @DeleteMapping("/admin/publishers/{id}")
    public ResponseEntity<Void> deletePublisher(
            @PathVariable("id") UUID id,
            @RequestHeader(name = HttpHeaders.IF_MATCH, required = false) String ifMatch) {
        return noContent(commandService.delete(id, conditionalRequests.expectedVersion(ifMatch)));
    }

    @PostMapping("/admin/publishers/{id}/restore")
    public ResponseEntity<Void> restorePublisher(
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
