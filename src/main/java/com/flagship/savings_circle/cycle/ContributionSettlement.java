package com.flagship.savings_circle.cycle;

import lombok.Value;

import java.util.UUID;

@Value
public class ContributionSettlement {

    public enum Status {
        PAID,
        ALREADY_PROCESSED,
        /** Contribution was already PAID or WAIVED by another payment; kept for refund review. */
        DUPLICATE_PAYMENT
    }

    String reference;
    UUID contributionId;
    int cycleNumber;
    Status status;
    long penaltyPaid;
    boolean cycleCompleted;
}
