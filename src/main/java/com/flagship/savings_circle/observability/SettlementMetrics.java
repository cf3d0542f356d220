package com.flagship.savings_circle.observability;

import com.flagship.savings_circle.payment.PaymentLedger;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters and timers for the slot, settlement and rotation paths.
 *
 * Tag values that come from outside (purposes, outcomes, webhook events) go
 * through {@link #sanitizeTag(String)} to keep cardinality bounded.
 */
@Component
@Slf4j
public class SettlementMetrics {

    private final MeterRegistry registry;
    private final PaymentLedger paymentLedger;
    private final AtomicLong flaggedForReview = new AtomicLong(0);

    public SettlementMetrics(MeterRegistry registry, PaymentLedger paymentLedger) {
        this.registry = registry;
        this.paymentLedger = paymentLedger;
        Gauge.builder("payments.review.queue", flaggedForReview, AtomicLong::get)
            .description("Payment records flagged for manual review")
            .register(registry);
    }

    public void recordSlotReservation(String result) {
        registry.counter("slots.reservations", "result", sanitizeTag(result)).increment();
    }

    /**
     * A verified entry payment got a slot other than the one requested.
     */
    public void recordSlotFallback() {
        registry.counter("slots.assignment.fallback").increment();
    }

    public void recordPaymentInitiated(String purpose) {
        registry.counter("payments.initiated", "purpose", sanitizeTag(purpose)).increment();
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    public void recordVerification(String outcome) {
        registry.counter("payments.verification", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordActivation(String result) {
        registry.counter("memberships.activation", "result", sanitizeTag(result)).increment();
    }

    public void recordContributionSettled(String result) {
        registry.counter("contributions.settlement", "result", sanitizeTag(result)).increment();
    }

    public void recordCycleCompleted() {
        registry.counter("cycles.completed").increment();
    }

    public void recordPayout(String status) {
        registry.counter("payouts.created", "status", sanitizeTag(status)).increment();
    }

    public void recordPenaltyApplied() {
        registry.counter("penalties.applied").increment();
    }

    public void recordWebhook(String result) {
        registry.counter("webhooks.received", "result", sanitizeTag(result)).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("settlement.latency", "operation", sanitizeTag(operation))
            .record(Duration.ofMillis(durationMs));
    }

    void refreshReviewQueue() {
        try {
            flaggedForReview.set(paymentLedger.countFlaggedForReview());
        } catch (Exception e) {
            log.warn("Failed to refresh review queue gauge: {}", e.getMessage());
        }
    }

    static String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
