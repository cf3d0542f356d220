package com.flagship.savings_circle.slot.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.savings_circle.slot.SlotEntity;
import com.flagship.savings_circle.slot.SlotStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Read-only view of a slot for display. Lapsed reservations are shown as available.
 */
@Value
@Builder
public class SlotView {

    @JsonProperty("slot_number")
    int slotNumber;

    @JsonProperty("status")
    SlotStatus status;

    @JsonProperty("reserved_by")
    UUID reservedBy;

    @JsonProperty("reserved_until")
    Instant reservedUntil;

    @JsonProperty("assigned_to")
    UUID assignedTo;

    public static SlotView from(SlotEntity slot, Instant now) {
        SlotStatus effective = slot.effectiveStatus(now);
        boolean reserved = effective == SlotStatus.RESERVED;
        return SlotView.builder()
            .slotNumber(slot.getSlotNumber())
            .status(effective)
            .reservedBy(reserved ? slot.getReservedBy() : null)
            .reservedUntil(reserved ? slot.getReservedUntil() : null)
            .assignedTo(slot.getAssignedTo())
            .build();
    }
}
