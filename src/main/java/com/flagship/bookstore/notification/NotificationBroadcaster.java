package com.flagship.bookstore.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Holds the Server-Sent Events subscribers of this instance.
 */
@Component
@Slf4j
public class NotificationBroadcaster {

    private final List<SseEmitter> emitters = new CopyOnWriteArrayList<>();

    @Value("${bookstore.notifications.sse-timeout-ms:1800000}")
    private long timeoutMs;

    public SseEmitter subscribe() {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        emitter.onCompletion(() -> emitters.remove(emitter));
        emitter.onTimeout(() -> emitters.remove(emitter));
        emitter.onError(e -> emitters.remove(emitter));
        emitters.add(emitter);
        log.debug("SSE subscriber added: subscribers={}", emitters.size());
        return emitter;
    }

    /**
     * Sends to every subscriber. A subscriber that cannot be written to is dropped.
     */
    public void broadcast(DomainNotification notification) {
        for (SseEmitter emitter : emitters) {
            try {
                emitter.send(SseEmitter.event()
                        .id(notification.getEventId().toString())
                        .name(notification.getEventType())
                        .data(notification));
            } catch (IOException | IllegalStateException e) {
                log.debug("Dropping SSE subscriber: {}", e.getMessage());
                emitters.remove(emitter);
                emitter.completeWithError(e);
            }
        }
    }

    public int subscriberCount() {
        return emitters.size();
    }
}
