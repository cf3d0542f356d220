package com.flagship.savings_circle.notification;

public enum NotificationType {
    MEMBERSHIP_ACTIVATED,
    GROUP_STARTED,
    CONTRIBUTION_RECEIVED,
    CYCLE_COMPLETED,
    PAYOUT_CREDITED,
    PENALTY_APPLIED
}
