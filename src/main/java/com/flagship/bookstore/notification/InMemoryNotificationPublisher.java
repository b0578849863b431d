package com.flagship.bookstore.notification;

import com.flagship.bookstore.observability.PipelineMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Broadcasts directly to this instance's subscribers.
 */
@Component
@ConditionalOnProperty(name = "bookstore.notifications.transport", havingValue = "memory")
@RequiredArgsConstructor
@Slf4j
public class InMemoryNotificationPublisher implements NotificationPublisher {

    private final NotificationBroadcaster broadcaster;
    private final PipelineMetrics metrics;

    @Override
    public void publish(DomainNotification notification) {
        log.debug("Broadcasting {} for {}", notification.getEventType(), notification.getEntityId());
        broadcaster.broadcast(notification);
        metrics.recordNotification(transport(), true);
    }

    @Override
    public String transport() {
        return "memory";
    }
}
