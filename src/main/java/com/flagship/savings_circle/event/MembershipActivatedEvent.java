package com.flagship.savings_circle.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A verified entry payment turned a reservation into an active membership.
 */
@Value
public class MembershipActivatedEvent implements GroupEvent {
    public static final String EVENT_TYPE = "MembershipActivated";

    UUID eventId;
    UUID groupId;
    UUID userId;
    int slotNumber;
    String reference;
    boolean groupActivated;
    Instant occurredAt;

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static MembershipActivatedEvent of(UUID groupId, UUID userId, int slotNumber, String reference,
                                              boolean groupActivated, Instant occurredAt) {
        return new MembershipActivatedEvent(UUID.randomUUID(), groupId, userId, slotNumber, reference,
            groupActivated, occurredAt);
    }
}
