package com.flagship.bookstore.catalog;

import com.fasterxml.jackson.core.type.TypeReference;
import com.flagship.bookstore.cache.CacheKey;
import com.flagship.bookstore.cache.CacheTag;
import com.flagship.bookstore.cache.EntityKind;
import com.flagship.bookstore.cache.TaggedCache;
import com.flagship.bookstore.domain.EntityNotFoundException;
import com.flagship.bookstore.projection.ProjectionDocument;
import com.flagship.bookstore.projection.ProjectionStore;
import org.springframework.data.domain.Page;

import java.util.Comparator;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Cached reads over one projection document type.
 *
 * Item responses are stored under the item key and tagged with the item tag; list pages
 * under a key built from the query and tagged with the collection tag. Both tags are the
 * ones the invalidation handlers evict.
 *
 * @param <D> projection document type
 * @param <R> response type
 */
public abstract class DocumentQueryService<D extends ProjectionDocument, R extends VersionedResponse> {

    protected final ProjectionStore store;
    private final TaggedCache cache;
    private final CacheSettings settings;

    protected DocumentQueryService(ProjectionStore store, TaggedCache cache, CacheSettings settings) {
        this.store = store;
        this.cache = cache;
        this.settings = settings;
    }

    protected abstract EntityKind entityKind();

    protected abstract Class<D> documentType();

    protected abstract TypeReference<R> responseType();

    protected abstract TypeReference<PagedResponse<R>> pageType();

    protected abstract R toResponse(D document);

    /**
     * Whether the document matches the lower-cased search term.
     */
    protected abstract boolean matchesSearch(D document, String term);

    /**
     * Sort orders by name. The first entry is the default.
     */
    protected abstract Map<String, Comparator<D>> sortOrders();

    /**
     * Extra filters beyond search and deletion. Matches everything by default.
     */
    protected boolean matchesFilters(D document, ListQuery query) {
        return true;
    }

    /**
     * Adjusts a cached response with values that depend on the time of the read.
     */
    protected R atReadTime(R response) {
        return response;
    }

    /**
     * Finds an entity, hiding soft-deleted ones unless asked for.
     *
     * @throws EntityNotFoundException if there is no document, or it is deleted and {@code includeDeleted} is false
     */
    public R get(UUID id, boolean includeDeleted) {
        EntityKind kind = entityKind();
        R response = cache.getOrCreate(
                CacheKey.item(kind, id),
                responseType(),
                () -> store.find(documentType(), id).map(this::toResponse).orElse(null),
                Set.of(CacheTag.item(kind, id)),
                settings.getItemTtl());

        if (response == null || (response.isDeleted() && !includeDeleted)) {
            throw new EntityNotFoundException(kind.getDisplayName(), id);
        }
        return atReadTime(response);
    }

    public PagedResponse<R> list(ListQuery query) {
        query.validate();
        Comparator<D> order = resolveSort(query.getSort());
        String term = query.hasSearch() ? query.getSearch().trim().toLowerCase(Locale.ROOT) : null;

        PagedResponse<R> cached = cache.getOrCreate(
                CacheKey.collection(entityKind(), query.cacheParameters()),
                pageType(),
                () -> {
                    Page<D> page = store.query(documentType(),
                            d -> (query.isIncludeDeleted() || !d.isDeleted())
                                    && (term == null || matchesSearch(d, term))
                                    && matchesFilters(d, query),
                            order, query.getPage(), query.getSize());
                    return PagedResponse.from(page, this::toResponse);
                },
                Set.of(CacheTag.collection(entityKind())),
                settings.getListTtl());
        return cached.map(this::atReadTime);
    }

    private Comparator<D> resolveSort(String sort) {
        Map<String, Comparator<D>> orders = sortOrders();
        if (sort == null || sort.isBlank()) {
            return orders.values().iterator().next();
        }
        boolean descending = sort.startsWith("-");
        String name = descending ? sort.substring(1) : sort;
        Comparator<D> order = orders.get(name);
        if (order == null) {
            throw new IllegalArgumentException("Unsupported sort '" + sort + "', expected one of " + orders.keySet());
        }
        return descending ? order.reversed() : order;
    }

    protected static boolean contains(String value, String term) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(term);
    }
}
