package com.flagship.savings_circle.slot;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class SlotReservation {
    UUID groupId;
    int slotNumber;
    UUID userId;
    Instant reservedUntil;
}
