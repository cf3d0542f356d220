package com.flagship.savings_circle.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.savings_circle.payment.SettlementResult;
import com.flagship.savings_circle.verification.VerificationOutcome;
import lombok.Value;

@Value
public class SettlementResponse {

    @JsonProperty("reference")
    String reference;

    @JsonProperty("verification")
    VerificationOutcome verification;

    @JsonProperty("status")
    SettlementResult.Status status;

    @JsonProperty("slot_number")
    Integer slotNumber;

    @JsonProperty("group_activated")
    boolean groupActivated;

    @JsonProperty("cycle_completed")
    boolean cycleCompleted;

    @JsonProperty("message")
    String message;

    public static SettlementResponse from(SettlementResult result) {
        return new SettlementResponse(
            result.getReference(),
            result.getVerification(),
            result.getStatus(),
            result.getSlotNumber(),
            result.isGroupActivated(),
            result.isCycleCompleted(),
            result.getMessage()
        );
    }
}
