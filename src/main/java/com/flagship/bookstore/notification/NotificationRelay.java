package com.flagship.bookstore.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

/**
 * Relays notifications from Kafka to this instance's SSE subscribers.
 *
 * Every instance joins with its own consumer group, so each one sees every record.
 * Notifications are informational: a record that cannot be read is logged and skipped.
 */
@Component
@ConditionalOnProperty(name = "bookstore.notifications.transport", havingValue = "kafka", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class NotificationRelay {

    private final NotificationBroadcaster broadcaster;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${kafka.topic.notifications:bookstore.notifications}",
        groupId = "bookstore-notifications-#{T(java.util.UUID).randomUUID().toString()}"
    )
    public void relay(ConsumerRecord<String, String> record) {
        log.debug("Received notification: partition={}, offset={}, key={}",
                record.partition(), record.offset(), record.key());
        try {
            DomainNotification notification = objectMapper.readValue(record.value(), DomainNotification.class);
            broadcaster.broadcast(notification);
        } catch (JsonProcessingException e) {
            log.warn("Skipping unreadable notification at offset {}: {}", record.offset(), e.getMessage());
        }
    }
}
