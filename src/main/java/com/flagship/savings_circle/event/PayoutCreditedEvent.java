package com.flagship.savings_circle.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A cycle's payout was credited to the recipient's wallet, or held as unclaimed
 * when no active member holds the recipient slot (recipientUserId is then null).
 */
@Value
public class PayoutCreditedEvent implements GroupEvent {
    public static final String EVENT_TYPE = "PayoutCredited";

    UUID eventId;
    UUID groupId;
    int cycleNumber;
    UUID recipientUserId;
    long grossAmount;
    long serviceFee;
    long amount;
    String status;
    Instant occurredAt;

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static PayoutCreditedEvent of(UUID groupId, int cycleNumber, UUID recipientUserId, long grossAmount,
                                         long serviceFee, long amount, String status, Instant occurredAt) {
        return new PayoutCreditedEvent(UUID.randomUUID(), groupId, cycleNumber, recipientUserId, grossAmount,
            serviceFee, amount, status, occurredAt);
    }
}
