package com.flagship.savings_circle.payment;

import com.flagship.savings_circle.cycle.ContributionSettler;
import com.flagship.savings_circle.membership.MembershipActivator;
import com.flagship.savings_circle.observability.CorrelationContext;
import com.flagship.savings_circle.verification.PaymentVerifier;
import com.flagship.savings_circle.verification.VerificationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * The one consumer of "this reference may have been paid".
 *
 * The synchronous verify endpoint, the gateway webhook and the reconciliation
 * scan all end up here. Verification and settlement are both idempotent, so
 * the producers can overlap freely.
 *
 * Not transactional: verification commits on its own, an entry payment's slot
 * is assigned in its own transaction, then the settlement runs in its own
 * transaction. A settlement failure is recorded on the
 * payment after that transaction has rolled back.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentSettlementService {

    private final PaymentVerifier paymentVerifier;
    private final PaymentLedger paymentLedger;
    private final MembershipActivator membershipActivator;
    private final ContributionSettler contributionSettler;

    /**
     * @throws PaymentNotFoundException if the reference was never initiated
     */
    public SettlementResult verifyAndSettle(String reference) {
        CorrelationContext.putReference(reference);
        try {
            VerificationResult verification = paymentVerifier.verify(reference);
            if (!verification.isVerified()) {
                log.info("Payment {} not settled, verification {}", reference, verification.getOutcome());
                return SettlementResult.notVerified(verification);
            }
            return settle(verification);
        } finally {
            CorrelationContext.clearPaymentContext();
        }
    }

    private SettlementResult settle(VerificationResult verification) {
        String reference = verification.getReference();
        PaymentPurpose purpose = verification.getRecord().getPurpose();
        CorrelationContext.putGroupId(purpose.groupId());
        try {
            if (purpose instanceof EntryPayment) {
                Integer slotNumber = membershipActivator.assignSlot(reference);
                return SettlementResult.of(verification, membershipActivator.activate(reference, slotNumber));
            } else if (purpose instanceof RecurringContribution) {
                return SettlementResult.of(verification, contributionSettler.settle(reference));
            }
            throw new IllegalStateException("Unhandled payment purpose " + purpose.type());
        } catch (RuntimeException e) {
            String reason = purpose instanceof EntryPayment
                ? PaymentLedger.REVIEW_ACTIVATION_FAILED
                : PaymentLedger.REVIEW_SETTLEMENT_FAILED;
            paymentLedger.flagForReview(reference, reason + ": " + e.getMessage());
            log.error("Verified payment {} could not be applied ({}); left for reconciliation", reference, reason, e);
            throw e;
        }
    }
}
