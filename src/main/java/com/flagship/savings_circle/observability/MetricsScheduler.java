package com.flagship.savings_circle.observability;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Refreshes gauges that need a database query.
 */
@Component
@RequiredArgsConstructor
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;
    private final SettlementMetrics settlementMetrics;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refresh() {
        outboxMetrics.refreshMetrics();
        settlementMetrics.refreshReviewQueue();
    }
}
