package com.flagship.savings_circle.group;

import java.time.LocalDate;

/**
 * How often a group collects contributions. Cycle n is due one period after cycle n-1.
 */
public enum Frequency {
    DAILY,
    WEEKLY,
    MONTHLY;

    /**
     * Due date of the given cycle for a group that started on {@code startDate}.
     * Cycle 1 is due on the start date itself.
     */
    public LocalDate dueDate(LocalDate startDate, int cycleNumber) {
        if (cycleNumber < 1) {
            throw new IllegalArgumentException("Cycle number must be at least 1, got " + cycleNumber);
        }
        long periods = cycleNumber - 1L;
        return switch (this) {
            case DAILY -> startDate.plusDays(periods);
            case WEEKLY -> startDate.plusWeeks(periods);
            case MONTHLY -> startDate.plusMonths(periods);
        };
    }
}
