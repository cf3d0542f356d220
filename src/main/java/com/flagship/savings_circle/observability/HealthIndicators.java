package com.flagship.savings_circle.observability;

import com.flagship.savings_circle.outbox.OutboxEventRepository;
import com.flagship.savings_circle.payment.PaymentLedger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Readiness signals specific to settlement.
 */
public class HealthIndicators {

    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        static final long BACKLOG_WARNING_THRESHOLD = 1000;
        static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxEventRepository outboxRepository;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository) {
            this.outboxRepository = outboxRepository;
        }

        @Override
        public Health health() {
            try {
                long backlog = outboxRepository.countUnpublished();
                Health.Builder builder = backlog < BACKLOG_WARNING_THRESHOLD
                    ? Health.up()
                    : backlog < BACKLOG_CRITICAL_THRESHOLD ? Health.status("WARNING") : Health.down();
                return builder
                    .withDetail("backlogSize", backlog)
                    .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                    .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                    .build();
            } catch (Exception e) {
                return Health.down().withDetail("error", e.getMessage()).build();
            }
        }
    }

    /**
     * Redis only fronts the idempotency lookup; losing it degrades to the database path.
     */
    @Component("redisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private final ObjectProvider<StringRedisTemplate> redisTemplateProvider;

        public RedisHealthIndicator(ObjectProvider<StringRedisTemplate> redisTemplateProvider) {
            this.redisTemplateProvider = redisTemplateProvider;
        }

        @Override
        public Health health() {
            StringRedisTemplate redisTemplate = redisTemplateProvider.getIfAvailable();
            if (redisTemplate == null || redisTemplate.getConnectionFactory() == null) {
                return degraded("Redis not configured");
            }
            try (var connection = redisTemplate.getConnectionFactory().getConnection()) {
                String pong = connection.ping();
                return "PONG".equals(pong)
                    ? Health.up().withDetail("response", pong).build()
                    : degraded("Unexpected ping response: " + pong);
            } catch (Exception e) {
                return degraded(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
        }

        private Health degraded(String error) {
            return Health.status("DEGRADED")
                .withDetail("error", error)
                .withDetail("note", "Idempotency lookups fall back to the database")
                .build();
        }
    }

    /**
     * Reports how many verified payments are waiting on an operator.
     * Never marks the service down: the queue is a work list, not an outage.
     */
    @Component("reconciliationHealth")
    public static class ReconciliationHealthIndicator implements HealthIndicator {

        private final PaymentLedger paymentLedger;

        public ReconciliationHealthIndicator(PaymentLedger paymentLedger) {
            this.paymentLedger = paymentLedger;
        }

        @Override
        public Health health() {
            try {
                long flagged = paymentLedger.countFlaggedForReview();
                Health.Builder builder = flagged == 0 ? Health.up() : Health.status("WARNING");
                return builder.withDetail("flaggedForReview", flagged).build();
            } catch (Exception e) {
                return Health.down().withDetail("error", e.getMessage()).build();
            }
        }
    }
}
