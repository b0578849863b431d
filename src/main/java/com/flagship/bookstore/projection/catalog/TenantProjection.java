package com.flagship.bookstore.projection.catalog;

import com.flagship.bookstore.domain.DomainEvent;
import com.flagship.bookstore.domain.tenant.Tenant;
import com.flagship.bookstore.domain.tenant.TenantCreated;
import com.flagship.bookstore.domain.tenant.TenantUpdated;
import com.flagship.bookstore.eventstore.StoredEvent;
import com.flagship.bookstore.projection.ProjectionLookup;
import com.flagship.bookstore.projection.SingleStreamProjection;
import org.springframework.stereotype.Component;

@Component
public class TenantProjection extends SingleStreamProjection<TenantDocument> {

    public TenantProjection() {
        super(Tenant.TYPE.getName());
    }

    @Override
    public Class<TenantDocument> documentType() {
        return TenantDocument.class;
    }

    @Override
    protected TenantDocument apply(TenantDocument current, StoredEvent event, ProjectionLookup lookup) {
        DomainEvent data = event.getData();
        if (data instanceof TenantCreated created) {
            return TenantDocument.builder()
                    .id(created.getTenantId())
                    .version(event.getVersion())
                    .lastModified(event.getTimestamp())
                    .name(created.getName())
                    .enabled(true)
                    .build();
        }
        if (data instanceof TenantUpdated updated) {
            return requireExisting(current, event).toBuilder()
                    .version(event.getVersion())
                    .lastModified(event.getTimestamp())
                    .name(updated.getName())
                    .enabled(updated.isEnabled())
                    .build();
        }
        throw unsupported(event);
    }
}
