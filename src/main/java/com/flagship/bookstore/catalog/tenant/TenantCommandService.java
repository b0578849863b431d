package com.flagship.bookstore.catalog.tenant;

import com.flagship.bookstore.catalog.AggregateCommandExecutor;
import com.flagship.bookstore.catalog.CommandResult;
import com.flagship.bookstore.catalog.tenant.dto.TenantRequest;
import com.flagship.bookstore.domain.tenant.Tenant;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.UUID;

@Service
@RequiredArgsConstructor
public class TenantCommandService {

    private final AggregateCommandExecutor executor;

    public CommandResult create(TenantRequest request) {
        UUID id = UUID.randomUUID();
        return executor.start(Tenant.TYPE, id, Tenant.create(id, request.getName()));
    }

    /**
     * Renames a tenant and sets its enabled flag. A missing flag keeps the current one.
     */
    public CommandResult update(UUID id, Long expectedVersion, TenantRequest request) {
        return executor.execute(Tenant.TYPE, id, expectedVersion, tenant -> tenant.update(
                request.getName(),
                request.getEnabled() != null ? request.getEnabled() : tenant.isEnabled()));
    }
}
