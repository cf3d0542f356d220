package com.flagship.savings_circle.payout;

import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Split of a cycle's collected amount. {@code payout + serviceFee == gross} always holds.
 */
@Value
public class PayoutCalculation {
    long gross;
    long serviceFee;
    long payout;

    /**
     * fee = ⌊gross × percentage / 100⌋, payout takes the remainder.
     */
    public static PayoutCalculation of(long gross, BigDecimal serviceFeePercentage) {
        if (gross < 0) {
            throw new IllegalArgumentException("Gross amount cannot be negative: " + gross);
        }
        long fee = BigDecimal.valueOf(gross)
            .multiply(serviceFeePercentage)
            .divide(BigDecimal.valueOf(100), 0, RoundingMode.FLOOR)
            .longValueExact();
        return new PayoutCalculation(gross, fee, gross - fee);
    }
}
