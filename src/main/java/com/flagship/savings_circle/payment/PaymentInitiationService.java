package com.flagship.savings_circle.payment;

import com.flagship.savings_circle.cycle.ContributionEntity;
import com.flagship.savings_circle.cycle.ContributionService;
import com.flagship.savings_circle.group.GroupEntity;
import com.flagship.savings_circle.group.GroupService;
import com.flagship.savings_circle.group.GroupStatus;
import com.flagship.savings_circle.membership.MembershipRepository;
import com.flagship.savings_circle.membership.MembershipStatus;
import com.flagship.savings_circle.observability.SettlementMetrics;
import com.flagship.savings_circle.payment.dto.InitiatePaymentRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Mints a payment reference and records the PENDING attempt.
 *
 * The amount always comes from server-side state (the group's entry amount,
 * or the contribution plus any outstanding penalty), never from the client.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentInitiationService {

    private static final String REFERENCE_PREFIX = "AJO-";

    private final PaymentLedger paymentLedger;
    private final IdempotencyService idempotencyService;
    private final GroupService groupService;
    private final MembershipRepository membershipRepository;
    private final ContributionService contributionService;
    private final SettlementMetrics settlementMetrics;

    /**
     * @param idempotencyKey optional; a repeated key returns the record it first created
     */
    public PaymentInitiation initiate(InitiatePaymentRequest request, String idempotencyKey) {
        long startTime = System.currentTimeMillis();

        if (idempotencyKey != null) {
            Optional<String> existing = idempotencyService.findReference(idempotencyKey);
            if (existing.isPresent()) {
                settlementMetrics.recordIdempotencyHit();
                log.info("Idempotency key already used, returning payment {}", existing.get());
                return new PaymentInitiation(paymentLedger.getByReference(existing.get()), true);
            }
            settlementMetrics.recordIdempotencyMiss();
        }

        GroupEntity group = groupService.getGroup(request.getGroupId());
        PaymentPurpose purpose;
        long amount;
        switch (request.getPurpose()) {
            case ENTRY_PAYMENT -> {
                requireJoinable(group, request.getUserId());
                if (request.getPreferredSlot() != null && request.getPreferredSlot() > group.getTotalSlots()) {
                    throw new IllegalArgumentException(String.format(
                        "Slot %d does not exist in a group of %d", request.getPreferredSlot(), group.getTotalSlots()));
                }
                purpose = new EntryPayment(group.getId(), request.getUserId(), request.getPreferredSlot());
                amount = group.entryAmount();
            }
            case RECURRING_CONTRIBUTION -> {
                ContributionEntity contribution = requirePayableContribution(group, request);
                purpose = new RecurringContribution(group.getId(), request.getUserId(),
                    contribution.getId(), contribution.getCycleNumber());
                amount = contribution.getAmount() + contributionService.outstandingPenalty(contribution.getId());
            }
            default -> throw new IllegalArgumentException("Unsupported purpose " + request.getPurpose());
        }

        String reference = newReference(purpose.type());
        PaymentRecord record = paymentLedger.recordAttempt(reference, amount, purpose, idempotencyKey);
        if (idempotencyKey != null) {
            idempotencyService.remember(idempotencyKey, record.getReference());
        }

        settlementMetrics.recordPaymentInitiated(purpose.type().name());
        settlementMetrics.recordLatency("initiate", System.currentTimeMillis() - startTime);
        log.info("Payment initiated: reference={}, groupId={}, userId={}, purpose={}, amount={}",
            record.getReference(), group.getId(), request.getUserId(), purpose.type(), amount);
        return new PaymentInitiation(record, !record.getReference().equals(reference));
    }

    private void requireJoinable(GroupEntity group, UUID userId) {
        if (group.getStatus() != GroupStatus.FORMING) {
            throw new IllegalStateException(String.format(
                "Group %s is %s and not accepting entry payments", group.getId(), group.getStatus()));
        }
        if (membershipRepository.existsByGroupIdAndUserIdAndStatus(group.getId(), userId, MembershipStatus.ACTIVE)) {
            throw new IllegalStateException(String.format(
                "User %s is already an active member of group %s", userId, group.getId()));
        }
    }

    private ContributionEntity requirePayableContribution(GroupEntity group, InitiatePaymentRequest request) {
        if (request.getContributionId() == null) {
            throw new IllegalArgumentException("contributionId is required for a recurring contribution");
        }
        ContributionEntity contribution = contributionService.getContribution(request.getContributionId());
        if (!contribution.getGroupId().equals(group.getId()) || !contribution.getUserId().equals(request.getUserId())) {
            throw new IllegalArgumentException(String.format(
                "Contribution %s does not belong to user %s in group %s",
                contribution.getId(), request.getUserId(), group.getId()));
        }
        if (!contribution.getStatus().isPayable()) {
            throw new IllegalStateException(String.format(
                "Contribution %s is %s and cannot be paid", contribution.getId(), contribution.getStatus()));
        }
        return contribution;
    }

    private static String newReference(PurposeType type) {
        String suffix = UUID.randomUUID().toString().replace("-", "").toUpperCase(Locale.ROOT);
        return REFERENCE_PREFIX + type.referenceCode() + "-" + suffix;
    }
}
