package com.flagship.savings_circle.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class PenaltyAppliedEvent implements GroupEvent {
    public static final String EVENT_TYPE = "PenaltyApplied";

    UUID eventId;
    UUID groupId;
    UUID userId;
    UUID contributionId;
    int cycleNumber;
    long amount;
    long daysOverdue;
    Instant occurredAt;

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static PenaltyAppliedEvent of(UUID groupId, UUID userId, UUID contributionId, int cycleNumber,
                                         long amount, long daysOverdue, Instant occurredAt) {
        return new PenaltyAppliedEvent(UUID.randomUUID(), groupId, userId, contributionId, cycleNumber,
            amount, daysOverdue, occurredAt);
    }
}
