package com.flagship.savings_circle.slot;

/**
 * State of a rotation position.
 *
 * A RESERVED slot whose expiry has passed is treated as AVAILABLE by every
 * allocation query; nothing sweeps expired reservations in the background.
 */
public enum SlotStatus {
    AVAILABLE,
    RESERVED,
    /**
     * Held by an active member. Terminal until the group is cancelled.
     */
    ASSIGNED
}
