package com.flagship.bookstore.projection;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Drains the projection channel in the background and periodically catches up
 * from the event store, starting right after startup.
 *
 * Disable with {@code bookstore.projections.daemon.enabled=false} to drive
 * {@link ProjectionWorker#drain()} by hand.
 */
@Component
@EnableScheduling
@ConditionalOnProperty(name = "bookstore.projections.daemon.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class ProjectionDaemon {

    private final ProjectionWorker worker;

    @Scheduled(fixedDelayString = "${bookstore.projections.poll-interval-ms:250}")
    public void poll() {
        try {
            int processed = worker.drain();
            if (processed > 0) {
                log.debug("Projection daemon processed {} stream batch(es)", processed);
            }
        } catch (Exception e) {
            log.error("Error in projection daemon polling loop", e);
        }
    }

    @Scheduled(fixedDelayString = "${bookstore.projections.catch-up-interval-ms:10000}")
    public void catchUp() {
        try {
            int read = worker.catchUp();
            if (read > 0) {
                log.debug("Projection catch-up read {} event(s), checkpoint at {}", read, worker.checkpoint());
            }
        } catch (Exception e) {
            log.error("Error in projection catch-up", e);
        }
    }
}
