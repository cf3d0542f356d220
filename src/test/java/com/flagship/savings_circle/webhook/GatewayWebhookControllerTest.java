package com.flagship.savings_circle.webhook;

import com.flagship.savings_circle.config.GatewayProperties;
import com.flagship.savings_circle.config.JacksonConfig;
import com.flagship.savings_circle.exception.GlobalExceptionHandler;
import com.flagship.savings_circle.gateway.WebhookSignatureVerifier;
import com.flagship.savings_circle.observability.SettlementMetrics;
import com.flagship.savings_circle.payment.PaymentNotFoundException;
import com.flagship.savings_circle.payment.PaymentSettlementService;
import com.flagship.savings_circle.payment.SettlementResult;
import com.flagship.savings_circle.verification.VerificationOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Webhook receiver tests with a real signature verifier and a mocked settlement service.
 */
class GatewayWebhookControllerTest {

    private static final String REFERENCE = "AJO-ENT-WEBHOOK";

    private WebhookSignatureVerifier signatureVerifier;
    private PaymentSettlementService settlementService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        GatewayProperties properties = new GatewayProperties();
        properties.setWebhookSecret("whsec_test");
        signatureVerifier = new WebhookSignatureVerifier(properties);
        settlementService = mock(PaymentSettlementService.class);

        GatewayWebhookController controller = new GatewayWebhookController(signatureVerifier, settlementService,
            new JacksonConfig().objectMapper(), mock(SettlementMetrics.class));
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
    }

    @Test
    @DisplayName("Signed charge.success should trigger settlement")
    void testChargeSuccess_Settles() throws Exception {
        String body = chargeEvent("charge.success", REFERENCE);
        when(settlementService.verifyAndSettle(REFERENCE)).thenReturn(new SettlementResult(
            REFERENCE, VerificationOutcome.VERIFIED, SettlementResult.Status.MEMBERSHIP_ACTIVATED, 2, false, false, null));

        mockMvc.perform(post("/api/webhooks/gateway")
                .contentType(MediaType.APPLICATION_JSON)
                .header("x-paystack-signature", signatureVerifier.sign(body))
                .content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.processed").value(true))
            .andExpect(jsonPath("$.status").value("MEMBERSHIP_ACTIVATED"));

        verify(settlementService).verifyAndSettle(REFERENCE);
    }

    @Test
    @DisplayName("Missing or wrong signature should return 401 without settling")
    void testBadSignature_Rejected() throws Exception {
        String body = chargeEvent("charge.success", REFERENCE);

        mockMvc.perform(post("/api/webhooks/gateway")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isUnauthorized());

        mockMvc.perform(post("/api/webhooks/gateway")
                .contentType(MediaType.APPLICATION_JSON)
                .header("x-paystack-signature", signatureVerifier.sign(body + "tampered"))
                .content(body))
            .andExpect(status().isUnauthorized())
            .andExpect(jsonPath("$.error").value("Invalid Signature"));

        verify(settlementService, never()).verifyAndSettle(anyString());
    }

    @Test
    @DisplayName("Events other than charges should be acknowledged and ignored")
    void testOtherEvent_Ignored() throws Exception {
        String body = chargeEvent("transfer.success", REFERENCE);

        mockMvc.perform(post("/api/webhooks/gateway")
                .contentType(MediaType.APPLICATION_JSON)
                .header("x-paystack-signature", signatureVerifier.sign(body))
                .content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.processed").value(false));

        verify(settlementService, never()).verifyAndSettle(anyString());
    }

    @Test
    @DisplayName("Unknown references should be acknowledged so the gateway stops retrying")
    void testUnknownReference_Acknowledged() throws Exception {
        String body = chargeEvent("charge.success", "AJO-ENT-ELSEWHERE");
        when(settlementService.verifyAndSettle("AJO-ENT-ELSEWHERE"))
            .thenThrow(new PaymentNotFoundException("AJO-ENT-ELSEWHERE"));

        mockMvc.perform(post("/api/webhooks/gateway")
                .contentType(MediaType.APPLICATION_JSON)
                .header("x-paystack-signature", signatureVerifier.sign(body))
                .content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.processed").value(false));
    }

    @Test
    @DisplayName("Signed but malformed bodies should return 400")
    void testMalformedBody_BadRequest() throws Exception {
        String body = "[1,2,3]";

        mockMvc.perform(post("/api/webhooks/gateway")
                .contentType(MediaType.APPLICATION_JSON)
                .header("x-paystack-signature", signatureVerifier.sign(body))
                .content(body))
            .andExpect(status().isBadRequest());
    }

    private static String chargeEvent(String event, String reference) {
        return "{\"event\":\"" + event + "\",\"data\":{\"reference\":\"" + reference
            + "\",\"amount\":110000,\"status\":\"success\"}}";
    }
}
