package com.flagship.savings_circle.slot.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.savings_circle.slot.SlotReservation;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class SlotReservationResponse {

    @JsonProperty("group_id")
    UUID groupId;

    @JsonProperty("slot_number")
    int slotNumber;

    @JsonProperty("user_id")
    UUID userId;

    @JsonProperty("reserved_until")
    Instant reservedUntil;

    public static SlotReservationResponse from(SlotReservation reservation) {
        return SlotReservationResponse.builder()
            .groupId(reservation.getGroupId())
            .slotNumber(reservation.getSlotNumber())
            .userId(reservation.getUserId())
            .reservedUntil(reservation.getReservedUntil())
            .build();
    }
}
