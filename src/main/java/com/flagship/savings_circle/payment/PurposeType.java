package com.flagship.savings_circle.payment;

/**
 * Persisted discriminator of {@link PaymentPurpose}.
 */
public enum PurposeType {
    ENTRY_PAYMENT("ENT"),
    RECURRING_CONTRIBUTION("CON");

    private final String referenceCode;

    PurposeType(String referenceCode) {
        this.referenceCode = referenceCode;
    }

    public String referenceCode() {
        return referenceCode;
    }
}
