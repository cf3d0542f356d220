package com.flagship.savings_circle.slot.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.UUID;

/**
 * Join request: reserve a specific slot, or the lowest free one when slot_number is omitted.
 */
@Value
public class ReserveSlotRequest {

    @NotNull(message = "User ID is required")
    @JsonProperty("user_id")
    UUID userId;

    @Min(value = 1, message = "Slot number must be at least 1")
    @JsonProperty("slot_number")
    Integer slotNumber;
}
