package com.flagship.savings_circle.cycle;

public enum ContributionStatus {
    PENDING,
    PAID,
    OVERDUE,
    WAIVED;

    /**
     * PAID and WAIVED count as settled when deciding whether a cycle is complete.
     */
    public boolean isSettled() {
        return this == PAID || this == WAIVED;
    }

    public boolean isPayable() {
        return this == PENDING || this == OVERDUE;
    }
}
