package com.flagship.savings_circle.payment;

import lombok.Value;

import java.time.Instant;

/**
 * One payment attempt as stored in the payment ledger.
 *
 * {@code processed} says whether the purpose's side effects (membership
 * activation or contribution settlement) have been applied. It only ever
 * becomes true for a VERIFIED record, and only once.
 */
@Value
public class PaymentRecord {
    String reference;
    String idempotencyKey;
    PaymentPurpose purpose;
    long expectedAmount;
    Long gatewayAmount;
    String currency;
    VerificationStatus verificationStatus;
    boolean processed;
    String reviewReason;
    Instant verifiedAt;
    Instant processedAt;
    Instant createdAt;

    public boolean isPending() {
        return verificationStatus == VerificationStatus.PENDING;
    }

    public boolean isVerified() {
        return verificationStatus == VerificationStatus.VERIFIED;
    }

    public boolean isFlaggedForReview() {
        return reviewReason != null;
    }
}
