package com.flagship.savings_circle.payment;

import com.flagship.savings_circle.cycle.ContributionSettlement;
import com.flagship.savings_circle.membership.ActivationResult;
import com.flagship.savings_circle.verification.VerificationOutcome;
import com.flagship.savings_circle.verification.VerificationResult;
import lombok.Value;

/**
 * What {@link PaymentSettlementService#verifyAndSettle} did with a reference.
 */
@Value
public class SettlementResult {

    public enum Status {
        /** Verification has no positive verdict; nothing was applied. */
        NOT_VERIFIED,
        MEMBERSHIP_ACTIVATED,
        CONTRIBUTION_PAID,
        ALREADY_PROCESSED,
        /** Claimed but not applied; recorded on the payment for refund review. */
        FLAGGED_FOR_REVIEW
    }

    String reference;
    VerificationOutcome verification;
    Status status;
    Integer slotNumber;
    boolean groupActivated;
    boolean cycleCompleted;
    String message;

    public static SettlementResult notVerified(VerificationResult verification) {
        return new SettlementResult(verification.getReference(), verification.getOutcome(), Status.NOT_VERIFIED,
            null, false, false, verification.getMessage());
    }

    public static SettlementResult of(VerificationResult verification, ActivationResult activation) {
        Status status = switch (activation.getStatus()) {
            case ACTIVATED -> Status.MEMBERSHIP_ACTIVATED;
            case ALREADY_PROCESSED -> Status.ALREADY_PROCESSED;
            case DUPLICATE_ENTRY -> Status.FLAGGED_FOR_REVIEW;
        };
        return new SettlementResult(verification.getReference(), verification.getOutcome(), status,
            activation.getSlotNumber(), activation.isGroupActivated(), false, null);
    }

    public static SettlementResult of(VerificationResult verification, ContributionSettlement settlement) {
        Status status = switch (settlement.getStatus()) {
            case PAID -> Status.CONTRIBUTION_PAID;
            case ALREADY_PROCESSED -> Status.ALREADY_PROCESSED;
            case DUPLICATE_PAYMENT -> Status.FLAGGED_FOR_REVIEW;
        };
        return new SettlementResult(verification.getReference(), verification.getOutcome(), status,
            null, false, settlement.isCycleCompleted(), null);
    }
}
