package com.flagship.savings_circle.payment;

public class PaymentNotFoundException extends RuntimeException {

    public PaymentNotFoundException(String reference) {
        super("Payment not found: " + reference);
    }
}
