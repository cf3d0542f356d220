package com.flagship.savings_circle.cycle;

/**
 * PENDING → ACTIVE → COMPLETED, one way. At most one ACTIVE cycle per group.
 */
public enum CycleStatus {
    PENDING,
    ACTIVE,
    COMPLETED
}
