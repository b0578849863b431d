package com.flagship.bookstore.invalidation;

import com.flagship.bookstore.projection.Projection;
import com.flagship.bookstore.projection.ProjectionDocument;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Invalidation handlers keyed by projection document type.
 *
 * At startup every projection's document type must have a handler. In strict mode a
 * missing handler fails startup; in lenient mode it is logged and the router skips
 * such documents at runtime.
 */
@Component
@Slf4j
public class InvalidationHandlerRegistry {

    private final Map<Class<?>, InvalidationHandler<?>> handlers = new HashMap<>();
    private final List<Projection<?>> projections;
    private final boolean strict;

    public InvalidationHandlerRegistry(List<InvalidationHandler<?>> handlers,
                                       List<Projection<?>> projections,
                                       @Value("${bookstore.invalidation.strict-startup-check:true}") boolean strict) {
        for (InvalidationHandler<?> handler : handlers) {
            InvalidationHandler<?> existing = this.handlers.putIfAbsent(handler.documentType(), handler);
            if (existing != null) {
                throw new IllegalStateException(String.format("Duplicate invalidation handlers for %s: %s and %s",
                        handler.documentType().getSimpleName(),
                        existing.getClass().getSimpleName(), handler.getClass().getSimpleName()));
            }
        }
        this.projections = projections;
        this.strict = strict;
    }

    @PostConstruct
    public void verifyCompleteness() {
        List<String> missing = missingHandlers();
        if (missing.isEmpty()) {
            log.info("Invalidation handlers registered for all {} projection document type(s)", projections.size());
            return;
        }
        String message = "No invalidation handler for projection document type(s): " + missing;
        if (strict) {
            throw new IllegalStateException(message);
        }
        log.warn("{}. Their changes will not invalidate the cache.", message);
    }

    public List<String> missingHandlers() {
        return projections.stream()
                .map(Projection::documentType)
                .filter(type -> !handlers.containsKey(type))
                .map(Class::getSimpleName)
                .distinct()
                .toList();
    }

    public Optional<InvalidationHandler<?>> find(Class<? extends ProjectionDocument> documentType) {
        return Optional.ofNullable(handlers.get(documentType));
    }
}
