package com.flagship.bookstore.catalog.category;

import com.flagship.bookstore.catalog.CommandResult;
import com.flagship.bookstore.catalog.ListQuery;
import com.flagship.bookstore.catalog.PagedResponse;
import com.flagship.bookstore.catalog.category.dto.CategoryRequest;
import com.flagship.bookstore.catalog.category.dto.CategoryResponse;
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
 * Public category reads under {@code /api/categories}, writes under {@code /api/admin/categories}.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class CategoryController {

    private final CategoryQueryService queryService;
    private final CategoryCommandService commandService;
    private final ConditionalRequestSupport conditionalRequests;

    @GetMapping("/categories")
    public ResponseEntity<PagedResponse<CategoryResponse>> listCategories(
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

    @GetMapping("/categories/{id}")
    public ResponseEntity<CategoryResponse> getCategory(
            @PathVariable("id") UUID id,
            @RequestHeader(name = HttpHeaders.IF_NONE_MATCH, required = false) String ifNoneMatch) {
        CategoryResponse category = queryService.get(id, false);
        return conditionalRequests.conditionalGet(category.getVersion(), category.getStatisticsVersion(), ifNoneMatch,
                () -> category);
    }

    @PostMapping("/admin/categories")
    public ResponseEntity<Void> createCategory(@Valid @RequestBody CategoryRequest request) {
        CommandResult result = commandService.create(request);
        log.info("Created category {}", result.getId());
        return ResponseEntity.created(URI.create("/api/categories/" + result.getId()))
                .headers(conditionalRequests.etagHeaders(result.getVersion()))
                .build();
    }

    @PutMapping("/admin/categories/{id}")
    public ResponseEntity<Void> updateCategory(
            @PathVariable("id") UUID id,
            @RequestHeader(name = HttpHeaders.IF_MATCH, required = false) String ifMatch,
            @Valid @RequestBody CategoryRequest request) {
        return noContent(commandService.update(id, conditionalRequests.expectedVersion(ifMatch), request));
    }

    @DeleteMapping("/admin/categories/{id}")
    public ResponseEntity<Void> deleteCategory(
            @PathVariable("id") UUID id,
            @RequestHeader(name = HttpHeaders.IF_MATCH, required = false) String ifMatch) {
        return noContent(commandService.delete(id, conditionalRequests.expectedVersion(ifMatch)));
    }

    @PostMapping("/admin/categories/{id}/restore")
    public ResponseEntity<Void> restoreCategory(
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
