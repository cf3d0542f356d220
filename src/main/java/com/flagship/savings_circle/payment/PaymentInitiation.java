package com.flagship.savings_circle.payment;

import lombok.Value;

@Value
public class PaymentInitiation {
    PaymentRecord record;
    /** True when an Idempotency-Key matched an earlier request and nothing new was recorded. */
    boolean replayed;
}
