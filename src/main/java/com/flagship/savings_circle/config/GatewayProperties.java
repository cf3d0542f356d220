package com.flagship.savings_circle.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Payment gateway connection settings.
 *
 * The secret key authenticates verification calls and must never leave the server.
 * The webhook secret signs inbound webhook bodies; Paystack uses the secret key for both.
 *
 * Every attempt may spend the connect and read timeouts in full, so the retry settings
 * and the two timeouts together must fit inside {@code verifyTimeout}.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "gateway")
public class GatewayProperties {

    @NotBlank
    private String baseUrl = "https://api.paystack.co";

    @NotBlank
    private String secretKey;

    @NotBlank
    private String webhookSecret;

    @NotNull
    private Duration connectTimeout = Duration.ofSeconds(2);

    @NotNull
    private Duration readTimeout = Duration.ofSeconds(7);

    @NotNull
    private Duration verifyTimeout = Duration.ofSeconds(30);

    @Valid
    private Retry retry = new Retry();

    /**
     * Longest a single verification can take: every attempt timing out on connect and
     * read, plus the backoff between attempts.
     */
    public Duration worstCaseVerification() {
        Duration perAttempt = connectTimeout.plus(readTimeout);
        Duration total = perAttempt.multipliedBy(retry.getMaxAttempts());
        double backoffMillis = retry.getInitialBackoff().toMillis();
        for (int attempt = 1; attempt < retry.getMaxAttempts(); attempt++) {
            total = total.plusMillis((long) backoffMillis);
            backoffMillis *= retry.getMultiplier();
        }
        return total;
    }

    @AssertTrue(message = "gateway timeouts and retries must fit within gateway.verify-timeout")
    public boolean isWithinVerifyTimeout() {
        if (connectTimeout == null || readTimeout == null || verifyTimeout == null
            || retry == null || retry.getInitialBackoff() == null) {
            return true;
        }
        return worstCaseVerification().compareTo(verifyTimeout) <= 0;
    }

    @Getter
    @Setter
    public static class Retry {

        @Min(1)
        private int maxAttempts = 3;

        @NotNull
        private Duration initialBackoff = Duration.ofMillis(500);

        @DecimalMin("1.0")
        private double multiplier = 2.0;
    }
}
