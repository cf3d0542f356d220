package com.flagship.savings_circle.cycle;

import com.flagship.savings_circle.event.ContributionPaidEvent;
import com.flagship.savings_circle.ledger.LedgerService;
import com.flagship.savings_circle.ledger.LedgerTransaction;
import com.flagship.savings_circle.ledger.TransactionType;
import com.flagship.savings_circle.observability.SettlementMetrics;
import com.flagship.savings_circle.outbox.OutboxService;
import com.flagship.savings_circle.payment.PaymentLedger;
import com.flagship.savings_circle.payment.PaymentRecord;
import com.flagship.savings_circle.payment.RecurringContribution;
import com.flagship.savings_circle.penalty.PenaltyRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

/**
 * Applies a verified recurring contribution payment.
 *
 * Order inside the single transaction:
 * 1. Claim the reference (loser returns ALREADY_PROCESSED)
 * 2. Lock the cycle row
 * 3. Contribution PENDING|OVERDUE → PAID, its APPLIED penalty → PAID when the payment covered it
 * 4. Audit transactions and the ContributionPaid event
 * 5. Try to complete the cycle
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContributionSettler {

    private final PaymentLedger paymentLedger;
    private final ContributionRepository contributionRepository;
    private final ContributionCycleRepository cycleRepository;
    private final PenaltyRepository penaltyRepository;
    private final CycleScheduler cycleScheduler;
    private final LedgerService ledgerService;
    private final OutboxService outboxService;
    private final SettlementMetrics metrics;
    private final Clock clock;

    @Transactional
    public ContributionSettlement settle(String reference) {
        PaymentRecord record = paymentLedger.getByReference(reference);
        if (!(record.getPurpose() instanceof RecurringContribution purpose)) {
            throw new IllegalArgumentException("Payment " + reference + " is not a recurring contribution");
        }
        if (!record.isVerified()) {
            throw new IllegalStateException(
                "Payment " + reference + " is " + record.getVerificationStatus() + ", not VERIFIED");
        }

        if (!paymentLedger.markProcessed(reference)) {
            log.info("Payment {} already applied to contribution {}", reference, purpose.contributionId());
            metrics.recordContributionSettled("already_processed");
            return result(reference, purpose, ContributionSettlement.Status.ALREADY_PROCESSED, 0, false);
        }

        cycleRepository.lockByGroupIdAndCycleNumber(purpose.groupId(), purpose.cycleNumber())
            .orElseThrow(() -> new IllegalStateException(
                "Cycle " + purpose.cycleNumber() + " does not exist in group " + purpose.groupId()));
        ContributionEntity contribution = contributionRepository.findById(purpose.contributionId())
            .orElseThrow(() -> new ContributionNotFoundException(purpose.contributionId()));

        Instant now = clock.instant();
        if (contributionRepository.markPaid(contribution.getId(), reference, now) == 0) {
            ContributionStatus current = contributionRepository.findById(contribution.getId())
                .map(ContributionEntity::getStatus)
                .orElse(contribution.getStatus());
            paymentLedger.noteReviewReason(reference,
                String.format("%s: contribution %s already %s",
                    PaymentLedger.REVIEW_DUPLICATE_PAYMENT, contribution.getId(), current));
            metrics.recordContributionSettled("duplicate");
            return result(reference, purpose, ContributionSettlement.Status.DUPLICATE_PAYMENT, 0, false);
        }

        long penaltyPaid = settlePenalty(record, contribution, now);

        ledgerService.post(LedgerTransaction.of(reference + "_C" + contribution.getCycleNumber(),
            contribution.getUserId(), contribution.getGroupId(), TransactionType.CONTRIBUTION,
            contribution.getAmount(), "Cycle " + contribution.getCycleNumber() + " contribution"));
        if (penaltyPaid > 0) {
            ledgerService.post(LedgerTransaction.of(reference + "_P", contribution.getUserId(),
                contribution.getGroupId(), TransactionType.PENALTY, penaltyPaid,
                "Late payment penalty, cycle " + contribution.getCycleNumber()));
        }

        outboxService.saveEvent(ContributionPaidEvent.of(contribution.getGroupId(), contribution.getUserId(),
            contribution.getId(), contribution.getCycleNumber(), contribution.getAmount(), penaltyPaid,
            reference, now));
        metrics.recordContributionSettled("paid");
        log.info("Contribution {} (cycle {}) paid by {}, penalty {}",
            contribution.getId(), contribution.getCycleNumber(), reference, penaltyPaid);

        boolean cycleCompleted = cycleScheduler.advanceIfComplete(contribution.getGroupId(), contribution.getCycleNumber());
        return result(reference, purpose, ContributionSettlement.Status.PAID, penaltyPaid, cycleCompleted);
    }

    /**
     * Marks the APPLIED penalty PAID only when the amount charged covered it. A
     * penalty applied after the payment was initiated stays outstanding.
     */
    private long settlePenalty(PaymentRecord record, ContributionEntity contribution, Instant now) {
        long penalty = penaltyRepository.findAppliedAmount(contribution.getId()).orElse(0L);
        if (penalty == 0) {
            return 0;
        }
        if (record.getExpectedAmount() < contribution.getAmount() + penalty) {
            log.warn("Payment {} did not include the {} penalty on contribution {}; penalty stays applied",
                record.getReference(), penalty, contribution.getId());
            return 0;
        }
        penaltyRepository.markPaid(contribution.getId(), now);
        return penalty;
    }

    private ContributionSettlement result(String reference, RecurringContribution purpose,
                                          ContributionSettlement.Status status, long penaltyPaid,
                                          boolean cycleCompleted) {
        return new ContributionSettlement(reference, purpose.contributionId(), purpose.cycleNumber(),
            status, penaltyPaid, cycleCompleted);
    }
}
