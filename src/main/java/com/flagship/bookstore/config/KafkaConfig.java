package com.flagship.bookstore.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topic for domain notifications. Only active with the Kafka transport.
 */
@Configuration
@ConditionalOnProperty(name = "bookstore.notifications.transport", havingValue = "kafka", matchIfMissing = true)
public class KafkaConfig {

    @Value("${kafka.topic.notifications:bookstore.notifications}")
    private String notificationsTopic;

    /**
     * Keyed by entity id, so notifications for one entity stay ordered within a partition.
     */
    @Bean
    public NewTopic notificationsTopic() {
        return TopicBuilder.name(notificationsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
