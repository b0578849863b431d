package com.flagship.bookstore.catalog.tenant;

import com.flagship.bookstore.catalog.CommandResult;
import com.flagship.bookstore.catalog.ListQuery;
import com.flagship.bookstore.catalog.PagedResponse;
import com.flagship.bookstore.catalog.tenant.dto.TenantRequest;
import com.flagship.bookstore.catalog.tenant.dto.TenantResponse;
import com.flagship.bookstore.web.ConditionalRequestSupport;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
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

@RestController
@RequestMapping("/api/admin/tenants")
@RequiredArgsConstructor
@Slf4j
public class TenantController {

    private final TenantQueryService queryService;
    private final TenantCommandService commandService;
    private final ConditionalRequestSupport conditionalRequests;

    @GetMapping
    public ResponseEntity<PagedResponse<TenantResponse>> listTenants(
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size,
            @RequestParam(name = "search", required = false) String search) {
        ListQuery query = ListQuery.builder()
                .page(page)
                .size(size)
                .search(search)
                .build();
        return ResponseEntity.ok(queryService.list(query));
    }

    @GetMapping("/{id}")
    public ResponseEntity<TenantResponse> getTenant(
            @PathVariable("id") UUID id,
            @RequestHeader(name = HttpHeaders.IF_NONE_MATCH, required = false) String ifNoneMatch) {
        TenantResponse tenant = queryService.get(id, false);
        return conditionalRequests.conditionalGet(tenant.getVersion(), ifNoneMatch, () -> tenant);
    }

    @PostMapping
    public ResponseEntity<Void> createTenant(@Valid @RequestBody TenantRequest request) {
        CommandResult result = commandService.create(request);
        log.info("Created tenant {}", result.getId());
        return ResponseEntity.created(URI.create("/api/admin/tenants/" + result.getId()))
                .headers(conditionalRequests.etagHeaders(result.getVersion()))
                .build();
    }

    @PutMapping("/{id}")
    public ResponseEntity<Void> updateTenant(
            @PathVariable("id") UUID id,
            @RequestHeader(name = HttpHeaders.IF_MATCH, required = false) String ifMatch,
            @Valid @RequestBody TenantRequest request) {
        CommandResult result = commandService.update(id, conditionalRequests.expectedVersion(ifMatch), request);
        return ResponseEntity.noContent()
                .headers(conditionalRequests.etagHeaders(result.getVersion()))
                .build();
    }
}
