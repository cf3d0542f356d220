package com.flagship.savings_circle.payout;

import com.flagship.savings_circle.cycle.ContributionRepository;
import com.flagship.savings_circle.cycle.ContributionCycleRepository;
import com.flagship.savings_circle.event.PayoutCreditedEvent;
import com.flagship.savings_circle.group.GroupEntity;
import com.flagship.savings_circle.group.GroupNotFoundException;
import com.flagship.savings_circle.group.GroupRepository;
import com.flagship.savings_circle.ledger.LedgerService;
import com.flagship.savings_circle.ledger.LedgerTransaction;
import com.flagship.savings_circle.ledger.TransactionType;
import com.flagship.savings_circle.membership.MembershipEntity;
import com.flagship.savings_circle.membership.MembershipRepository;
import com.flagship.savings_circle.membership.MembershipStatus;
import com.flagship.savings_circle.observability.SettlementMetrics;
import com.flagship.savings_circle.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Pays out a completed cycle to the member holding the matching slot.
 *
 * Only called by the caller that won the cycle's ACTIVE → COMPLETED update,
 * inside that same transaction. The payout row is unique per (group, cycle),
 * so a stray second call finds the existing payout and stops.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PayoutEngine {

    private final GroupRepository groupRepository;
    private final ContributionRepository contributionRepository;
    private final ContributionCycleRepository cycleRepository;
    private final MembershipRepository membershipRepository;
    private final PayoutRepository payoutRepository;
    private final LedgerService ledgerService;
    private final OutboxService outboxService;
    private final SettlementMetrics metrics;
    private final Clock clock;

    @Transactional(propagation = Propagation.MANDATORY)
    public PayoutEntity settle(UUID groupId, int cycleNumber) {
        Optional<PayoutEntity> existing = payoutRepository.findByGroupIdAndCycleNumber(groupId, cycleNumber);
        if (existing.isPresent()) {
            log.info("Cycle {} of group {} already paid out, skipping", cycleNumber, groupId);
            return existing.get();
        }

        GroupEntity group = groupRepository.findById(groupId)
            .orElseThrow(() -> new GroupNotFoundException(groupId));
        PayoutCalculation calculation = PayoutCalculation.of(
            contributionRepository.sumPaid(groupId, cycleNumber), group.getServiceFeePercentage());

        Optional<MembershipEntity> recipient = membershipRepository
            .findByGroupIdAndSlotNumberAndStatus(groupId, cycleNumber, MembershipStatus.ACTIVE);
        UUID recipientUserId = recipient.map(MembershipEntity::getUserId).orElse(null);

        Instant now = clock.instant();
        PayoutEntity payout = payoutRepository.saveAndFlush(
            PayoutEntity.of(groupId, cycleNumber, cycleNumber, recipientUserId, calculation, now));

        if (recipientUserId != null) {
            ledgerService.creditWallet(recipientUserId, calculation.getPayout());
        } else {
            log.warn("No active member holds slot {} in group {}; payout of {} recorded as unclaimed",
                cycleNumber, groupId, calculation.getPayout());
        }

        ledgerService.post(LedgerTransaction.of(
            "PAYOUT-" + groupId + "-" + cycleNumber, recipientUserId, groupId, TransactionType.PAYOUT,
            calculation.getPayout(), "Cycle " + cycleNumber + " payout"));
        ledgerService.post(LedgerTransaction.of(
            "FEE-" + groupId + "-" + cycleNumber, null, groupId, TransactionType.SERVICE_FEE,
            calculation.getServiceFee(), "Cycle " + cycleNumber + " service fee"));

        cycleRepository.recordPayout(groupId, cycleNumber, calculation.getPayout(), calculation.getServiceFee());

        outboxService.saveEvent(PayoutCreditedEvent.of(groupId, cycleNumber, recipientUserId,
            calculation.getGross(), calculation.getServiceFee(), calculation.getPayout(),
            payout.getStatus().name(), now));
        metrics.recordPayout(payout.getStatus().name());

        log.info("Cycle {} of group {} paid out: gross={}, fee={}, payout={}, recipient={}",
            cycleNumber, groupId, calculation.getGross(), calculation.getServiceFee(),
            calculation.getPayout(), recipientUserId);
        return payout;
    }

    public List<PayoutEntity> getPayouts(UUID groupId) {
        return payoutRepository.findByGroupIdOrderByCycleNumberAsc(groupId);
    }
}
