package com.flagship.savings_circle.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class ContributionPaidEvent implements GroupEvent {
    public static final String EVENT_TYPE = "ContributionPaid";

    UUID eventId;
    UUID groupId;
    UUID userId;
    UUID contributionId;
    int cycleNumber;
    long amount;
    long penaltyAmount;
    String reference;
    Instant occurredAt;

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static ContributionPaidEvent of(UUID groupId, UUID userId, UUID contributionId, int cycleNumber,
                                           long amount, long penaltyAmount, String reference, Instant occurredAt) {
        return new ContributionPaidEvent(UUID.randomUUID(), groupId, userId, contributionId, cycleNumber,
            amount, penaltyAmount, reference, occurredAt);
    }
}
