package com.flagship.savings_circle.gateway;

import com.flagship.savings_circle.config.GatewayProperties;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Checks {@code x-paystack-signature}: lowercase hex of HMAC-SHA512 over the raw
 * request body, keyed with the webhook secret.
 */
@Component
public class WebhookSignatureVerifier {

    private static final String ALGORITHM = "HmacSHA512";

    private final GatewayProperties properties;

    public WebhookSignatureVerifier(GatewayProperties properties) {
        this.properties = properties;
    }

    /**
     * @throws InvalidSignatureException if the signature is missing or does not match
     */
    public void verify(String rawBody, String signature) {
        if (signature == null || signature.isBlank()) {
            throw new InvalidSignatureException("Missing webhook signature");
        }
        byte[] expected = sign(rawBody).getBytes(StandardCharsets.US_ASCII);
        byte[] actual = signature.trim().toLowerCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII);
        if (!MessageDigest.isEqual(expected, actual)) {
            throw new InvalidSignatureException("Webhook signature mismatch");
        }
    }

    public String sign(String rawBody) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(properties.getWebhookSecret().getBytes(StandardCharsets.UTF_8), ALGORITHM));
            byte[] digest = mac.doFinal((rawBody == null ? "" : rawBody).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA512 unavailable", e);
        }
    }
}
