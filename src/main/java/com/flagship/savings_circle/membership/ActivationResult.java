package com.flagship.savings_circle.membership;

import lombok.Value;

import java.util.UUID;

@Value
public class ActivationResult {

    public enum Status {
        ACTIVATED,
        /** Another caller already applied this reference. */
        ALREADY_PROCESSED,
        /** The payer was already an active member; payment kept for refund review. */
        DUPLICATE_ENTRY
    }

    String reference;
    UUID groupId;
    UUID userId;
    Integer slotNumber;
    Status status;
    boolean groupActivated;

    public static ActivationResult activated(String reference, UUID groupId, UUID userId, int slotNumber,
                                             boolean groupActivated) {
        return new ActivationResult(reference, groupId, userId, slotNumber, Status.ACTIVATED, groupActivated);
    }

    public static ActivationResult alreadyProcessed(String reference, UUID groupId, UUID userId, Integer slotNumber) {
        return new ActivationResult(reference, groupId, userId, slotNumber, Status.ALREADY_PROCESSED, false);
    }

    public static ActivationResult duplicateEntry(String reference, UUID groupId, UUID userId, Integer slotNumber) {
        return new ActivationResult(reference, groupId, userId, slotNumber, Status.DUPLICATE_ENTRY, false);
    }
}
