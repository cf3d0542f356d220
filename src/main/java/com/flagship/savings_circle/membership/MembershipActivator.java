package com.flagship.savings_circle.membership;

import com.flagship.savings_circle.cycle.ContributionRepository;
import com.flagship.savings_circle.cycle.CycleScheduler;
import com.flagship.savings_circle.event.MembershipActivatedEvent;
import com.flagship.savings_circle.group.GroupEntity;
import com.flagship.savings_circle.group.GroupNotFoundException;
import com.flagship.savings_circle.group.GroupRepository;
import com.flagship.savings_circle.ledger.LedgerService;
import com.flagship.savings_circle.ledger.LedgerTransaction;
import com.flagship.savings_circle.ledger.TransactionType;
import com.flagship.savings_circle.observability.SettlementMetrics;
import com.flagship.savings_circle.outbox.OutboxService;
import com.flagship.savings_circle.payment.EntryPayment;
import com.flagship.savings_circle.payment.PaymentLedger;
import com.flagship.savings_circle.payment.PaymentRecord;
import com.flagship.savings_circle.slot.SlotRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

/**
 * Turns a verified entry payment into an active membership.
 *
 * Two steps, called in order with no transaction open:
 * 1. {@link #assignSlot} secures the payer's slot in its own short transaction.
 *    It is durable, and a retry after a failure gets the same slot back.
 * 2. {@link #activate} is one transaction that starts by claiming the reference,
 *    so the claim and every other side effect commit or roll back together.
 *
 * Keeping the assignment out of the activation transaction means an activation
 * never holds one pooled connection while waiting for a second.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MembershipActivator {

    private final PaymentLedger paymentLedger;
    private final SlotRegistry slotRegistry;
    private final GroupRepository groupRepository;
    private final MembershipRepository membershipRepository;
    private final ContributionRepository contributionRepository;
    private final CycleScheduler cycleScheduler;
    private final LedgerService ledgerService;
    private final OutboxService outboxService;
    private final SettlementMetrics metrics;
    private final Clock clock;

    /**
     * Assigns the payer's slot, using the preference recorded at initiation.
     *
     * A payment that was already applied, or a payer who is already an active
     * member, gets their existing slot back and nothing is written.
     *
     * @return the payer's slot, or null if the payment was applied and the membership is gone
     * @throws IllegalArgumentException if the reference is not an entry payment
     * @throws IllegalStateException if the payment is not VERIFIED
     * @throws com.flagship.savings_circle.slot.NoSlotsAvailableException if the group is full
     */
    public Integer assignSlot(String reference) {
        PaymentRecord record = paymentLedger.getByReference(reference);
        EntryPayment entry = verifiedEntry(record);
        UUID groupId = entry.groupId();
        UUID userId = entry.userId();

        Optional<MembershipEntity> existing = membershipRepository.findByGroupIdAndUserId(groupId, userId);
        if (record.isProcessed() || (existing.isPresent() && existing.get().isActive())) {
            return existing.map(MembershipEntity::getSlotNumber).orElse(null);
        }

        try {
            return slotRegistry.assignSlot(groupId, entry.preferredSlot(), userId);
        } catch (DataIntegrityViolationException e) {
            // another settlement for the same payer committed an assignment first
            return slotRegistry.findAssignedSlot(groupId, userId).orElseThrow(() -> e);
        }
    }

    /**
     * @param slotNumber the slot returned by {@link #assignSlot} for this reference
     * @throws IllegalArgumentException if the reference is not an entry payment
     * @throws IllegalStateException if the payment is not VERIFIED or the group cannot take the member
     */
    @Transactional
    public ActivationResult activate(String reference, Integer slotNumber) {
        PaymentRecord record = paymentLedger.getByReference(reference);
        EntryPayment entry = verifiedEntry(record);
        UUID groupId = entry.groupId();
        UUID userId = entry.userId();

        if (!paymentLedger.markProcessed(reference)) {
            Integer slot = membershipRepository.findByGroupIdAndUserId(groupId, userId)
                .map(MembershipEntity::getSlotNumber)
                .orElse(null);
            log.info("Entry payment {} already applied, user {} holds slot {}", reference, userId, slot);
            metrics.recordActivation("already_processed");
            return ActivationResult.alreadyProcessed(reference, groupId, userId, slot);
        }

        Optional<MembershipEntity> existing = membershipRepository.findByGroupIdAndUserId(groupId, userId);
        if (existing.isPresent() && existing.get().isActive()) {
            paymentLedger.noteReviewReason(reference, String.format(
                "%s: user %s is already an active member of group %s",
                PaymentLedger.REVIEW_DUPLICATE_ENTRY, userId, groupId));
            metrics.recordActivation("duplicate_entry");
            return ActivationResult.duplicateEntry(reference, groupId, userId, existing.get().getSlotNumber());
        }

        if (slotNumber == null) {
            throw new IllegalStateException("No slot secured for entry payment " + reference);
        }

        Instant now = clock.instant();
        membershipRepository.upsertActive(UUID.randomUUID(), groupId, userId, slotNumber, reference, now);
        MembershipEntity membership = membershipRepository.findByGroupIdAndUserId(groupId, userId)
            .orElseThrow(() -> new IllegalStateException("Membership missing after upsert for " + reference));

        if (groupRepository.incrementMemberCount(groupId, now) == 0) {
            throw new IllegalStateException("Group " + groupId + " is no longer accepting members");
        }
        GroupEntity group = groupRepository.findById(groupId).orElseThrow(() -> new GroupNotFoundException(groupId));

        LocalDate today = LocalDate.ofInstant(now, ZoneOffset.UTC);
        // due on the join date until initializeCycles moves it to the start date
        contributionRepository.insertPaid(UUID.randomUUID(), membership.getId(), groupId, userId, 1,
            group.getContributionAmount(), today, reference, now);

        ledgerService.post(LedgerTransaction.of(reference + "_SD", userId, groupId,
            TransactionType.SECURITY_DEPOSIT, group.securityDepositAmount(), "Security deposit"));
        ledgerService.post(LedgerTransaction.of(reference + "_C1", userId, groupId,
            TransactionType.CONTRIBUTION, group.getContributionAmount(), "Cycle 1 contribution"));

        boolean groupActivated = group.isFull() && groupRepository.activateIfFull(groupId, today, now) == 1;

        outboxService.saveEvent(MembershipActivatedEvent.of(groupId, userId, slotNumber, reference, groupActivated, now));

        if (groupActivated) {
            log.info("Group {} is full and now ACTIVE, starting {}", groupId, today);
            cycleScheduler.initializeCycles(groupId);
        }

        metrics.recordActivation("activated");
        log.info("Membership activated: groupId={}, userId={}, slot={}, reference={}",
            groupId, userId, slotNumber, reference);
        return ActivationResult.activated(reference, groupId, userId, slotNumber, groupActivated);
    }

    private static EntryPayment verifiedEntry(PaymentRecord record) {
        if (!(record.getPurpose() instanceof EntryPayment entry)) {
            throw new IllegalArgumentException("Payment " + record.getReference() + " is not an entry payment");
        }
        if (!record.isVerified()) {
            throw new IllegalStateException(
                "Payment " + record.getReference() + " is " + record.getVerificationStatus() + ", not VERIFIED");
        }
        return entry;
    }
}
