package com.flagship.savings_circle.penalty;

public enum PenaltyType {
    LATE_PAYMENT
}
