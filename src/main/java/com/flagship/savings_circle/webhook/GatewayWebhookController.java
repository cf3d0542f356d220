package com.flagship.savings_circle.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.savings_circle.gateway.InvalidSignatureException;
import com.flagship.savings_circle.gateway.WebhookSignatureVerifier;
import com.flagship.savings_circle.observability.SettlementMetrics;
import com.flagship.savings_circle.payment.PaymentNotFoundException;
import com.flagship.savings_circle.payment.PaymentSettlementService;
import com.flagship.savings_circle.payment.SettlementResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.Set;

/**
 * Gateway webhook receiver.
 *
 * The body is taken as a raw string because the signature covers the exact
 * bytes sent. The event itself is only a hint: settlement always re-verifies
 * the reference with the gateway before applying anything.
 */
@RestController
@RequestMapping("/api/webhooks")
@RequiredArgsConstructor
@Slf4j
public class GatewayWebhookController {

    static final String SIGNATURE_HEADER = "x-paystack-signature";
    private static final Set<String> SETTLEMENT_EVENTS = Set.of("charge.success", "charge.failed");

    private final WebhookSignatureVerifier signatureVerifier;
    private final PaymentSettlementService settlementService;
    private final ObjectMapper objectMapper;
    private final SettlementMetrics settlementMetrics;

    @PostMapping("/gateway")
    public ResponseEntity<Map<String, Object>> receive(
            @RequestBody String rawBody,
            @RequestHeader(value = SIGNATURE_HEADER, required = false) String signature) {

        try {
            signatureVerifier.verify(rawBody, signature);
        } catch (InvalidSignatureException e) {
            settlementMetrics.recordWebhook("rejected");
            throw e;
        }

        GatewayWebhookEvent event = parse(rawBody);
        if (!SETTLEMENT_EVENTS.contains(event.getEvent())) {
            log.info("Ignoring webhook event {}", event.getEvent());
            settlementMetrics.recordWebhook("ignored");
            return ResponseEntity.ok(Map.of("received", true, "processed", false));
        }
        if (event.getReference() == null || event.getReference().isBlank()) {
            log.warn("Webhook event {} carries no reference, ignoring", event.getEvent());
            settlementMetrics.recordWebhook("ignored");
            return ResponseEntity.ok(Map.of("received", true, "processed", false));
        }

        log.info("Webhook {} received for payment {}", event.getEvent(), event.getReference());
        try {
            SettlementResult result = settlementService.verifyAndSettle(event.getReference());
            settlementMetrics.recordWebhook("processed");
            return ResponseEntity.ok(Map.of(
                "received", true,
                "processed", true,
                "status", result.getStatus().name()));
        } catch (PaymentNotFoundException e) {
            // Not ours, or minted by another environment sharing the gateway account
            log.warn("Webhook {} for unknown reference {}", event.getEvent(), event.getReference());
            settlementMetrics.recordWebhook("unknown_reference");
            return ResponseEntity.ok(Map.of("received", true, "processed", false));
        }
    }

    private GatewayWebhookEvent parse(String rawBody) {
        try {
            JsonNode root = objectMapper.readTree(rawBody);
            if (root == null || !root.isObject()) {
                throw new IllegalArgumentException("Webhook body is not a JSON object");
            }
            JsonNode reference = root.path("data").path("reference");
            return new GatewayWebhookEvent(
                root.path("event").asText(""),
                reference.isTextual() ? reference.asText() : null);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Webhook body is not valid JSON", e);
        }
    }
}
