package com.flagship.savings_circle.cycle.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.savings_circle.cycle.ContributionCycleEntity;
import com.flagship.savings_circle.cycle.CycleStatus;
import lombok.Value;

import java.time.Instant;

@Value
public class CycleView {

    @JsonProperty("cycle_number")
    int cycleNumber;

    @JsonProperty("recipient_slot")
    int recipientSlot;

    @JsonProperty("status")
    CycleStatus status;

    @JsonProperty("collected_amount")
    long collectedAmount;

    @JsonProperty("payout_amount")
    Long payoutAmount;

    @JsonProperty("service_fee_collected")
    Long serviceFeeCollected;

    @JsonProperty("started_at")
    Instant startedAt;

    @JsonProperty("completed_at")
    Instant completedAt;

    public static CycleView from(ContributionCycleEntity cycle) {
        return new CycleView(
            cycle.getCycleNumber(),
            cycle.getRecipientSlot(),
            cycle.getStatus(),
            cycle.getCollectedAmount(),
            cycle.getPayoutAmount(),
            cycle.getServiceFeeCollected(),
            cycle.getStartedAt(),
            cycle.getCompletedAt()
        );
    }
}
