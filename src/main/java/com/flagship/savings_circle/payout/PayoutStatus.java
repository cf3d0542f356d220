package com.flagship.savings_circle.payout;

public enum PayoutStatus {
    CREDITED,

    /**
     * No active member held the recipient slot; the amount is held for an operator.
     */
    UNCLAIMED
}
