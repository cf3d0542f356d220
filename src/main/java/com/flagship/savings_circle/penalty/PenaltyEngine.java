package com.flagship.savings_circle.penalty;

import com.flagship.savings_circle.config.SettlementProperties;
import com.flagship.savings_circle.cycle.ContributionEntity;
import com.flagship.savings_circle.cycle.ContributionRepository;
import com.flagship.savings_circle.event.PenaltyAppliedEvent;
import com.flagship.savings_circle.observability.SettlementMetrics;
import com.flagship.savings_circle.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/**
 * Marks late contributions OVERDUE and charges one late-payment penalty each.
 *
 * Safe to re-run for any date: the status change is conditional and the
 * penalty insert is keyed on the contribution.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PenaltyEngine {

    private final ContributionRepository contributionRepository;
    private final PenaltyRepository penaltyRepository;
    private final OutboxService outboxService;
    private final SettlementProperties settlementProperties;
    private final SettlementMetrics metrics;
    private final Clock clock;

    /**
     * Runs the overdue pass for one group.
     */
    @Transactional
    public OverdueScanResult scanOverdue(UUID groupId, LocalDate asOf) {
        Instant now = clock.instant();
        int markedOverdue = contributionRepository.markOverdue(groupId, asOf, now);

        int penalties = 0;
        for (ContributionEntity contribution : contributionRepository.findOverdueWithoutPenalty(groupId)) {
            if (applyLatePenalty(contribution, asOf, now)) {
                penalties++;
            }
        }

        if (markedOverdue > 0 || penalties > 0) {
            log.info("Overdue scan for group {} as of {}: {} marked overdue, {} penalties applied",
                groupId, asOf, markedOverdue, penalties);
        }
        return new OverdueScanResult(markedOverdue, penalties);
    }

    private boolean applyLatePenalty(ContributionEntity contribution, LocalDate asOf, Instant now) {
        long amount = penaltyAmount(contribution.getAmount(), settlementProperties.getPenaltyRate());
        if (amount == 0) {
            log.debug("Penalty for contribution {} rounds to zero, skipping", contribution.getId());
            return false;
        }
        long daysOverdue = Math.max(0, ChronoUnit.DAYS.between(contribution.getDueDate(), asOf));
        String reason = "Late payment - " + daysOverdue + " days overdue";

        int inserted = penaltyRepository.insertIfAbsent(UUID.randomUUID(), contribution.getId(),
            contribution.getGroupId(), contribution.getUserId(), amount, PenaltyType.LATE_PAYMENT.name(), reason, now);
        if (inserted == 0) {
            return false;
        }

        outboxService.saveEvent(PenaltyAppliedEvent.of(contribution.getGroupId(), contribution.getUserId(),
            contribution.getId(), contribution.getCycleNumber(), amount, daysOverdue, now));
        metrics.recordPenaltyApplied();
        return true;
    }

    /**
     * ⌊amount × rate⌋ in minor units.
     */
    static long penaltyAmount(long contributionAmount, BigDecimal rate) {
        return BigDecimal.valueOf(contributionAmount)
            .multiply(rate)
            .setScale(0, RoundingMode.FLOOR)
            .longValueExact();
    }
}
