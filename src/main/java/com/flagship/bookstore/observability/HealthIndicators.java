package com.flagship.bookstore.observability;

import com.flagship.bookstore.projection.ProjectionWorker;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Health indicators for the projection pipeline and its backends.
 */
public class HealthIndicators {

    /**
     * Unhealthy when the projection backlog grows, since reads drift further behind writes.
     */
    @Component("projectionHealth")
    public static class ProjectionHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final ProjectionWorker worker;

        public ProjectionHealthIndicator(ProjectionWorker worker) {
            this.worker = worker;
        }

        @Override
        public Health health() {
            long backlog = worker.backlog();
            Health.Builder builder = backlog < BACKLOG_WARNING_THRESHOLD
                    ? Health.up()
                    : backlog < BACKLOG_CRITICAL_THRESHOLD
                    ? Health.status("WARNING")
                    : Health.down();

            return builder
                    .withDetail("backlog", backlog)
                    .withDetail("deadLettered", worker.deadLetteredCount())
                    .withDetail("checkpoint", worker.checkpoint())
                    .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                    .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                    .build();
        }
    }

    /**
     * Redis being down degrades reads to direct projection queries but blocks invalidation.
     */
    @Component("redisHealth")
    @ConditionalOnProperty(name = "bookstore.cache.type", havingValue = "redis", matchIfMissing = true)
    public static class RedisHealthIndicator implements HealthIndicator {

        private final StringRedisTemplate redisTemplate;

        public RedisHealthIndicator(StringRedisTemplate redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            try {
                var connectionFactory = redisTemplate.getConnectionFactory();
                if (connectionFactory == null) {
                    return Health.down()
                            .withDetail("error", "No connection factory configured")
                            .build();
                }

                try (var connection = connectionFactory.getConnection()) {
                    String result = connection.ping();
                    return "PONG".equals(result)
                            ? Health.up().withDetail("response", result).build()
                            : Health.down().withDetail("response", result != null ? result : "null").build();
                }
            } catch (Exception e) {
                return Health.status("DEGRADED")
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .withDetail("note", "Reads fall back to projection queries; invalidations fail")
                        .build();
            }
        }
    }

    @Component("kafkaHealth")
    @ConditionalOnProperty(name = "bookstore.notifications.transport", havingValue = "kafka", matchIfMissing = true)
    public static class KafkaHealthIndicator implements HealthIndicator {

        private final KafkaTemplate<String, String> kafkaTemplate;

        public KafkaHealthIndicator(KafkaTemplate<String, String> kafkaTemplate) {
            this.kafkaTemplate = kafkaTemplate;
        }

        @Override
        public Health health() {
            try {
                var metrics = kafkaTemplate.metrics();
                if (metrics == null || metrics.isEmpty()) {
                    return Health.down()
                            .withDetail("error", "No Kafka connections established")
                            .build();
                }
                return Health.up()
                        .withDetail("metricsCount", metrics.size())
                        .build();
            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }
}
