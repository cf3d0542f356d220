package com.flagship.savings_circle.membership;

public enum MembershipStatus {
    PENDING,
    ACTIVE,
    SUSPENDED,
    REMOVED
}
