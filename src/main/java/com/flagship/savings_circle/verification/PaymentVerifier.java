package com.flagship.savings_circle.verification;

import com.flagship.savings_circle.gateway.GatewayException;
import com.flagship.savings_circle.gateway.GatewayUnreachableException;
import com.flagship.savings_circle.gateway.GatewayVerification;
import com.flagship.savings_circle.gateway.PaymentGatewayClient;
import com.flagship.savings_circle.gateway.TransactionNotFoundException;
import com.flagship.savings_circle.observability.SettlementMetrics;
import com.flagship.savings_circle.payment.AmountMismatchException;
import com.flagship.savings_circle.payment.GatewayStatus;
import com.flagship.savings_circle.payment.PaymentLedger;
import com.flagship.savings_circle.payment.PaymentRecord;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Asks the gateway whether a reference was paid and records the verdict.
 *
 * Only ever touches the payment ledger. Membership and cycle effects belong to
 * the settlement path that runs after a VERIFIED result.
 *
 * No transaction around the gateway call: the ledger write commits on its own.
 */
@Service
@Slf4j
public class PaymentVerifier {

    private final PaymentLedger paymentLedger;
    private final PaymentGatewayClient gatewayClient;
    private final Retry gatewayRetry;
    private final SettlementMetrics metrics;

    public PaymentVerifier(PaymentLedger paymentLedger,
                           PaymentGatewayClient gatewayClient,
                           @Qualifier("gatewayRetry") Retry gatewayRetry,
                           SettlementMetrics metrics) {
        this.paymentLedger = paymentLedger;
        this.gatewayClient = gatewayClient;
        this.gatewayRetry = gatewayRetry;
        this.metrics = metrics;
    }

    /**
     * @throws com.flagship.savings_circle.payment.PaymentNotFoundException if the reference was never initiated
     */
    public VerificationResult verify(String reference) {
        PaymentRecord record = paymentLedger.getByReference(reference);
        if (!record.isPending()) {
            log.debug("Payment {} already {}, not calling gateway", reference, record.getVerificationStatus());
            return VerificationResult.fromRecord(record);
        }

        long started = System.currentTimeMillis();
        VerificationResult result = callGatewayAndRecord(record);
        metrics.recordLatency("verify", System.currentTimeMillis() - started);
        metrics.recordVerification(result.getOutcome().name());
        return result;
    }

    private VerificationResult callGatewayAndRecord(PaymentRecord record) {
        String reference = record.getReference();
        GatewayVerification verification;
        try {
            verification = Retry.decorateSupplier(gatewayRetry, () -> gatewayClient.verify(reference)).get();
        } catch (TransactionNotFoundException e) {
            log.warn("Gateway never saw payment {}, marking failed", reference);
            return VerificationResult.fromRecord(paymentLedger.markVerified(reference, 0, null, GatewayStatus.FAILED));
        } catch (GatewayUnreachableException e) {
            log.warn("Gateway unreachable verifying {}, leaving pending: {}", reference, e.getMessage());
            return VerificationResult.pending(record, e.getMessage());
        } catch (GatewayException e) {
            log.error("Gateway rejected verification of {}: {}", reference, e.getMessage());
            return VerificationResult.pending(record, e.getMessage());
        }

        if (!verification.isFinal()) {
            log.info("Payment {} still in progress at gateway", reference);
            return VerificationResult.pending(record, "Charge still in progress: " + verification.getGatewayResponse());
        }

        try {
            PaymentRecord updated = paymentLedger.markVerified(reference, verification.getAmount(),
                verification.getCurrency(), verification.getStatus());
            return VerificationResult.fromRecord(updated);
        } catch (AmountMismatchException e) {
            return VerificationResult.amountMismatch(paymentLedger.getByReference(reference), e.getMessage());
        }
    }
}
