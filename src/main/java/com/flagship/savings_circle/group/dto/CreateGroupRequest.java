package com.flagship.savings_circle.group.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.savings_circle.group.Frequency;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Request DTO for creating a savings group. Amounts are in minor units.
 */
@Value
public class CreateGroupRequest {

    @NotBlank(message = "Name is required")
    @JsonProperty("name")
    String name;

    @NotNull(message = "Contribution amount is required")
    @Positive(message = "Contribution amount must be greater than 0")
    @JsonProperty("contribution_amount")
    Long contributionAmount;

    @NotNull(message = "Frequency is required")
    @JsonProperty("frequency")
    Frequency frequency;

    @NotNull(message = "Total slots is required")
    @Min(value = 2, message = "A group needs at least 2 slots")
    @Max(value = 100, message = "A group can have at most 100 slots")
    @JsonProperty("total_slots")
    Integer totalSlots;

    @DecimalMin(value = "0.00", message = "Service fee cannot be negative")
    @DecimalMax(value = "50.00", message = "Service fee cannot exceed 50%")
    @JsonProperty("service_fee_percentage")
    BigDecimal serviceFeePercentage;

    @DecimalMin(value = "0.00", message = "Security deposit cannot be negative")
    @DecimalMax(value = "100.00", message = "Security deposit cannot exceed 100%")
    @JsonProperty("security_deposit_percentage")
    BigDecimal securityDepositPercentage;

    @NotNull(message = "Creator ID is required")
    @JsonProperty("created_by")
    UUID createdBy;
}
