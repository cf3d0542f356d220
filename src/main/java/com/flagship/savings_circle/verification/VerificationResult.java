package com.flagship.savings_circle.verification;

import com.flagship.savings_circle.payment.PaymentLedger;
import com.flagship.savings_circle.payment.PaymentRecord;
import lombok.Value;

/**
 * Outcome of verifying one reference, together with the ledger record as it stands afterwards.
 */
@Value
public class VerificationResult {
    String reference;
    VerificationOutcome outcome;
    PaymentRecord record;
    String message;

    public boolean isVerified() {
        return outcome == VerificationOutcome.VERIFIED;
    }

    /**
     * Maps a record that already carries a verdict to the matching outcome.
     */
    public static VerificationResult fromRecord(PaymentRecord record) {
        VerificationOutcome outcome = switch (record.getVerificationStatus()) {
            case VERIFIED -> VerificationOutcome.VERIFIED;
            case PENDING -> VerificationOutcome.PENDING;
            case FAILED -> isAmountMismatch(record) ? VerificationOutcome.AMOUNT_MISMATCH : VerificationOutcome.FAILED;
        };
        return new VerificationResult(record.getReference(), outcome, record, null);
    }

    public static VerificationResult pending(PaymentRecord record, String message) {
        return new VerificationResult(record.getReference(), VerificationOutcome.PENDING, record, message);
    }

    public static VerificationResult amountMismatch(PaymentRecord record, String message) {
        return new VerificationResult(record.getReference(), VerificationOutcome.AMOUNT_MISMATCH, record, message);
    }

    private static boolean isAmountMismatch(PaymentRecord record) {
        return record.getReviewReason() != null
            && record.getReviewReason().startsWith(PaymentLedger.REVIEW_AMOUNT_MISMATCH);
    }
}
