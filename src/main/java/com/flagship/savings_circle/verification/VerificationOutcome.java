package com.flagship.savings_circle.verification;

public enum VerificationOutcome {
    VERIFIED,
    FAILED,
    AMOUNT_MISMATCH,

    /**
     * No final answer yet: the gateway was unreachable or the charge is still in flight.
     * The ledger record stays PENDING and the reconciliation scan tries again.
     */
    PENDING
}
