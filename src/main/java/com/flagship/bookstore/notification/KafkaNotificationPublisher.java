package com.flagship.bookstore.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.bookstore.observability.PipelineMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Publishes notifications to Kafka, keyed by entity id.
 *
 * The send is not awaited; a failed send is logged and counted when the
 * broker acknowledgment completes.
 */
@Component
@ConditionalOnProperty(name = "bookstore.notifications.transport", havingValue = "kafka", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class KafkaNotificationPublisher implements NotificationPublisher {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final PipelineMetrics metrics;

    @Value("${kafka.topic.notifications:bookstore.notifications}")
    private String topic;

    @Override
    public void publish(DomainNotification notification) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(notification);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize notification " + notification.getEventType(), e);
        }

        kafkaTemplate.send(topic, notification.getEntityId().toString(), payload)
                .whenComplete((result, error) -> {
                    if (error != null) {
                        log.error("Failed to publish notification: eventType={}, entityId={}, error={}",
                                notification.getEventType(), notification.getEntityId(), error.getMessage());
                        metrics.recordNotification(transport(), false);
                        return;
                    }
                    metrics.recordNotification(transport(), true);
                    log.debug("Published notification: eventType={}, entityId={}, partition={}, offset={}",
                            notification.getEventType(), notification.getEntityId(),
                            result.getRecordMetadata().partition(), result.getRecordMetadata().offset());
                });
    }

    @Override
    public String transport() {
        return "kafka";
    }
}
