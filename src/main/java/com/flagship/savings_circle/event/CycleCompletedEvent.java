package com.flagship.savings_circle.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Every non-waived contribution of a cycle is paid and the cycle closed.
 *
 * {@code nextCycle} is null when this was the last cycle and the group completed.
 */
@Value
public class CycleCompletedEvent implements GroupEvent {
    public static final String EVENT_TYPE = "CycleCompleted";

    UUID eventId;
    UUID groupId;
    int cycleNumber;
    long collectedAmount;
    Integer nextCycle;
    boolean groupCompleted;
    Instant occurredAt;

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static CycleCompletedEvent of(UUID groupId, int cycleNumber, long collectedAmount,
                                         Integer nextCycle, Instant occurredAt) {
        return new CycleCompletedEvent(UUID.randomUUID(), groupId, cycleNumber, collectedAmount,
            nextCycle, nextCycle == null, occurredAt);
    }
}
