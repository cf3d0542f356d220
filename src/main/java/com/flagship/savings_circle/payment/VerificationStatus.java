package com.flagship.savings_circle.payment;

public enum VerificationStatus {
    /**
     * Reference minted, gateway has not confirmed either way.
     */
    PENDING,

    /**
     * Gateway confirmed success for exactly the expected amount.
     */
    VERIFIED,

    /**
     * Gateway declined, never saw the transaction, or the amount did not match.
     */
    FAILED
}
