package com.flagship.savings_circle.slot;

import java.util.UUID;

/**
 * Every slot in the group is assigned or under a live reservation.
 */
public class NoSlotsAvailableException extends RuntimeException {

    public NoSlotsAvailableException(UUID groupId) {
        super("No slots available in group " + groupId);
    }
}
