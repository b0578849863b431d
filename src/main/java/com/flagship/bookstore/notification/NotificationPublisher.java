package com.flagship.bookstore.notification;

/**
 * Fan-out of domain notifications to real-time clients.
 *
 * Fire-and-forget from the caller's side; delivery is the transport's concern.
 */
public interface NotificationPublisher {

    void publish(DomainNotification notification);

    /**
     * Transport name used in logs and metrics.
     */
    String transport();
}
