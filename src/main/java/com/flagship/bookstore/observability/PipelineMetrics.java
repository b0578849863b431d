package com.flagship.bookstore.observability;

import com.flagship.bookstore.projection.ProjectionChannel;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Metrics for the projection and invalidation pipeline.
 *
 * - Backlog: stream batches waiting on the projection channel
 * - Folds: per document type, success or failure
 * - Dead letters: stream batches that exhausted their retries
 * - Invalidations: tag removals and handled documents, by outcome
 * - Notifications: publishes per transport, by outcome
 *
 * Dead letters and failed invalidations both need an alert;
 * a failed invalidation leaves a stale cache entry until its TTL expires.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PipelineMetrics {

    private final MeterRegistry meterRegistry;
    private final ProjectionChannel projectionChannel;

    @PostConstruct
    public void init() {
        Gauge.builder("projection.channel.backlog", projectionChannel, ProjectionChannel::size)
                .description("Stream batches waiting to be projected")
                .register(meterRegistry);

        log.info("Pipeline metrics registered with Micrometer");
    }

    public void recordFold(String documentType, boolean success) {
        meterRegistry.counter("projection.folds",
                "document_type", documentType,
                "status", status(success)
        ).increment();
    }

    public void recordDeadLettered(String streamType) {
        meterRegistry.counter("projection.batches.dead_lettered",
                "stream_type", streamType
        ).increment();
    }

    public void recordCacheInvalidation(boolean success) {
        meterRegistry.counter("cache.invalidations",
                "status", status(success)
        ).increment();
    }

    public void recordInvalidatedDocument(String documentType, String changeKind, boolean success) {
        meterRegistry.counter("invalidation.documents",
                "document_type", documentType,
                "change_kind", changeKind,
                "status", status(success)
        ).increment();
    }

    public void recordNotification(String transport, boolean success) {
        meterRegistry.counter("notifications.published",
                "transport", transport,
                "status", status(success)
        ).increment();
    }

    private static String status(boolean success) {
        return success ? "success" : "failure";
    }
}
