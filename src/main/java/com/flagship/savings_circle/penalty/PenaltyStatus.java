package com.flagship.savings_circle.penalty;

public enum PenaltyStatus {
    APPLIED,
    PAID,
    WAIVED
}
