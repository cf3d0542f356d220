package com.flagship.savings_circle.payment;

import com.flagship.savings_circle.payment.dto.InitiatePaymentRequest;
import com.flagship.savings_circle.payment.dto.PaymentResponse;
import com.flagship.savings_circle.payment.dto.SettlementResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Payment initiation and the synchronous verification path.
 *
 * Key features:
 * - Optional Idempotency-Key header; a repeated key returns the original record with 200
 * - The amount to charge is computed server-side and returned with the reference
 * - Verify may be called any number of times; settlement happens at most once
 */
@RestController
@RequestMapping("/api/payments")
@RequiredArgsConstructor
@Slf4j
public class PaymentController {

    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final PaymentInitiationService initiationService;
    private final PaymentSettlementService settlementService;
    private final PaymentLedger paymentLedger;

    @PostMapping("/initiate")
    public ResponseEntity<PaymentResponse> initiate(
            @Valid @RequestBody InitiatePaymentRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {

        log.info("Payment initiation requested: groupId={}, userId={}, purpose={}, idempotencyKey={}",
            request.getGroupId(), request.getUserId(), request.getPurpose(), idempotencyKey);

        PaymentInitiation initiation = initiationService.initiate(request, idempotencyKey);

        HttpStatus status = initiation.isReplayed() ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(PaymentResponse.from(initiation.getRecord()));
    }

    @GetMapping("/{reference}")
    public ResponseEntity<PaymentResponse> getPayment(@PathVariable("reference") String reference) {
        return paymentLedger.findByReference(reference)
            .map(record -> ResponseEntity.ok(PaymentResponse.from(record)))
            .orElse(ResponseEntity.notFound().build());
    }

    /**
     * Verifies the reference with the gateway and applies it if the charge succeeded.
     */
    @PostMapping("/{reference}/verify")
    public ResponseEntity<SettlementResponse> verify(@PathVariable("reference") String reference) {
        SettlementResult result = settlementService.verifyAndSettle(reference);
        return ResponseEntity.ok(SettlementResponse.from(result));
    }
}
