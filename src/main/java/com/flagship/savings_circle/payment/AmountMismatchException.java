package com.flagship.savings_circle.payment;

import lombok.Getter;

/**
 * The gateway reports a successful charge for a different amount, or in a
 * different currency, than the payment's purpose requires. The record is
 * failed and flagged for review.
 */
@Getter
public class AmountMismatchException extends RuntimeException {

    private final String reference;
    private final long expectedAmount;
    private final long gatewayAmount;

    public AmountMismatchException(String reference, long expectedAmount, long gatewayAmount) {
        super(String.format("Payment %s amount mismatch: expected %d, gateway reported %d",
            reference, expectedAmount, gatewayAmount));
        this.reference = reference;
        this.expectedAmount = expectedAmount;
        this.gatewayAmount = gatewayAmount;
    }

    public AmountMismatchException(String reference, long expectedAmount, String expectedCurrency,
                                   long gatewayAmount, String gatewayCurrency) {
        super(String.format("Payment %s currency mismatch: expected %d %s, gateway reported %d %s",
            reference, expectedAmount, expectedCurrency, gatewayAmount, gatewayCurrency));
        this.reference = reference;
        this.expectedAmount = expectedAmount;
        this.gatewayAmount = gatewayAmount;
    }
}
