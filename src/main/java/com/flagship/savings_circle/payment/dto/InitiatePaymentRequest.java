package com.flagship.savings_circle.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.savings_circle.payment.PurposeType;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.UUID;

/**
 * Request to mint a payment reference.
 *
 * {@code preferred_slot} applies to entry payments, {@code contribution_id} is
 * required for recurring contributions. The amount is never taken from the client.
 */
@Value
public class InitiatePaymentRequest {

    @NotNull(message = "Group ID is required")
    @JsonProperty("group_id")
    UUID groupId;

    @NotNull(message = "User ID is required")
    @JsonProperty("user_id")
    UUID userId;

    @NotNull(message = "Purpose is required")
    @JsonProperty("purpose")
    PurposeType purpose;

    @Min(value = 1, message = "Slot number must be at least 1")
    @JsonProperty("preferred_slot")
    Integer preferredSlot;

    @JsonProperty("contribution_id")
    UUID contributionId;
}
