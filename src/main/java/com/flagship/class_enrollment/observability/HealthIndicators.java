package com.flagship.class_enrollment.observability;

import com.flagship.class_enrollment.outbox.OutboxEventRepository;
import com.flagship.class_enrollment.payment.ChargeReconciliationRepository;
import com.flagship.class_enrollment.payment.ReconciliationStatus;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Custom health indicators for the enrollment service.
 */
public class HealthIndicators {

    /**
     * Unhealthy if too many enrollment events are waiting to be published.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxEventRepository outboxRepository;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository) {
            this.outboxRepository = outboxRepository;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = outboxRepository.countUnpublished();

                Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                        ? Health.up()
                        : backlogSize < BACKLOG_CRITICAL_THRESHOLD
                        ? Health.status("WARNING")
                        : Health.down();

                return builder
                        .withDetail("backlogSize", backlogSize)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage())
                        .build();
            }
        }
    }

    /**
     * Reports charges taken from customers whose enrollment never committed.
     * Abandoned reversals need a manual refund, so they mark the service as WARNING.
     */
    @Component("chargeReconciliationHealth")
    public static class ChargeReconciliationHealthIndicator implements HealthIndicator {

        private final ChargeReconciliationRepository repository;

        public ChargeReconciliationHealthIndicator(ChargeReconciliationRepository repository) {
            this.repository = repository;
        }

        @Override
        public Health health() {
            try {
                long pending = repository.countByStatus(ReconciliationStatus.PENDING);
                long abandoned = repository.countByStatus(ReconciliationStatus.ABANDONED);

                Health.Builder builder = abandoned == 0 ? Health.up() : Health.status("WARNING");
                return builder
                        .withDetail("pending", pending)
                        .withDetail("abandoned", abandoned)
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage())
                        .build();
            }
        }
    }

    /**
     * Redis backs the duplicate-charge guard's fast path only.
     */
    @Component("redisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private final ObjectProvider<StringRedisTemplate> redisTemplate;

        public RedisHealthIndicator(ObjectProvider<StringRedisTemplate> redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            StringRedisTemplate template = redisTemplate.getIfAvailable();
            if (template == null || template.getConnectionFactory() == null) {
                return Health.status("DEGRADED")
                        .withDetail("error", "No Redis connection configured")
                        .withDetail("note", "Duplicate-charge guard falls back to the database")
                        .build();
            }

            try (var connection = template.getConnectionFactory().getConnection()) {
                String result = connection.ping();

                if ("PONG".equals(result)) {
                    return Health.up()
                            .withDetail("response", result)
                            .build();
                }
                return Health.down()
                        .withDetail("response", result != null ? result : "null")
                        .build();

            } catch (Exception e) {
                return Health.status("DEGRADED")
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .withDetail("note", "Duplicate-charge guard falls back to the database")
                        .build();
            }
        }
    }

    /**
     * Kafka carries the enrollment events; an outage delays them but loses nothing.
     */
    @Component("kafkaHealth")
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
