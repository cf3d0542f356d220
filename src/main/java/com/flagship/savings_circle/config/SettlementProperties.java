package com.flagship.savings_circle.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Business settings for slot reservation, penalties and payment reconciliation.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "settlement")
public class SettlementProperties {

    /** Single settlement currency, amounts are stored in its minor unit. */
    @Pattern(regexp = "^[A-Z]{3}$")
    private String currency = "NGN";

    /** How long a slot reservation (join request) holds a slot before it lapses. */
    @NotNull
    private Duration reservationTtl = Duration.ofMinutes(30);

    /** Fraction of the contribution charged when it becomes overdue. */
    @NotNull
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private BigDecimal penaltyRate = new BigDecimal("0.05");

    /** Pending payment records older than this are re-verified by the scheduled scan. */
    @NotNull
    private Duration reconcileAfter = Duration.ofMinutes(10);

    @Min(1)
    private int reconcileBatchSize = 50;
}
