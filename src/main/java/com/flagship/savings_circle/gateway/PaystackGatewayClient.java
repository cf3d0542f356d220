package com.flagship.savings_circle.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.savings_circle.payment.GatewayStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.util.Locale;
import java.util.Set;

/**
 * Paystack implementation: {@code GET /transaction/verify/{reference}} with the
 * secret key as bearer token.
 */
@Component
@Slf4j
public class PaystackGatewayClient implements PaymentGatewayClient {

    private static final Set<String> FAILED_STATES = Set.of("failed", "reversed", "abandoned");

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    public PaystackGatewayClient(@Qualifier("gatewayRestTemplate") RestTemplate restTemplate,
                                 ObjectMapper objectMapper) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public GatewayVerification verify(String reference) {
        String body;
        try {
            body = restTemplate.getForObject("/transaction/verify/{reference}", String.class, reference);
        } catch (HttpClientErrorException e) {
            if (e.getStatusCode() == HttpStatus.NOT_FOUND || mentionsNotFound(e.getResponseBodyAsString())) {
                throw new TransactionNotFoundException(reference);
            }
            throw new GatewayException(
                String.format("Gateway rejected verification of %s with %s", reference, e.getStatusCode()), e);
        } catch (HttpServerErrorException e) {
            throw new GatewayUnreachableException(
                String.format("Gateway returned %s verifying %s", e.getStatusCode(), reference), e);
        } catch (ResourceAccessException e) {
            throw new GatewayUnreachableException("Gateway unreachable verifying " + reference, e);
        }
        return parse(reference, body);
    }

    GatewayVerification parse(String reference, String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body == null ? "" : body);
        } catch (Exception e) {
            throw new GatewayUnreachableException("Unreadable gateway response for " + reference, e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            throw new GatewayUnreachableException("Empty gateway response for " + reference, null);
        }

        JsonNode data = root.path("data");
        if (!root.path("status").asBoolean(false) || data.isMissingNode() || data.isNull()) {
            if (mentionsNotFound(root.path("message").asText(""))) {
                throw new TransactionNotFoundException(reference);
            }
            throw new GatewayException("Gateway refused verification of " + reference + ": "
                + root.path("message").asText("no message"));
        }

        String chargeState = data.path("status").asText("").toLowerCase(Locale.ROOT);
        GatewayStatus status;
        if ("success".equals(chargeState)) {
            status = GatewayStatus.SUCCESS;
        } else if (FAILED_STATES.contains(chargeState)) {
            status = GatewayStatus.FAILED;
        } else {
            status = GatewayStatus.IN_PROGRESS;
        }

        log.debug("Gateway verification: reference={}, state={}, amount={}",
            reference, chargeState, data.path("amount").asLong(0));

        return new GatewayVerification(
            reference,
            status,
            data.path("amount").asLong(0),
            data.path("currency").asText(null),
            data.path("gateway_response").asText(null));
    }

    private static boolean mentionsNotFound(String message) {
        return message != null && message.toLowerCase(Locale.ROOT).contains("reference not found");
    }
}
