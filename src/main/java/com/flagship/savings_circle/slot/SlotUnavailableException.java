package com.flagship.savings_circle.slot;

import java.util.UUID;

/**
 * The requested slot is reserved by someone else or already assigned.
 */
public class SlotUnavailableException extends RuntimeException {

    public SlotUnavailableException(UUID groupId, int slotNumber) {
        super(String.format("Slot %d in group %s is not available", slotNumber, groupId));
    }
}
