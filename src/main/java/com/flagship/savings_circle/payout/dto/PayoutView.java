package com.flagship.savings_circle.payout.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.savings_circle.payout.PayoutEntity;
import com.flagship.savings_circle.payout.PayoutStatus;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class PayoutView {

    @JsonProperty("cycle_number")
    int cycleNumber;

    @JsonProperty("recipient_slot")
    int recipientSlot;

    @JsonProperty("recipient_user_id")
    UUID recipientUserId;

    @JsonProperty("gross_amount")
    long grossAmount;

    @JsonProperty("service_fee")
    long serviceFee;

    @JsonProperty("amount")
    long amount;

    @JsonProperty("status")
    PayoutStatus status;

    @JsonProperty("created_at")
    Instant createdAt;

    public static PayoutView from(PayoutEntity payout) {
        return new PayoutView(
            payout.getCycleNumber(),
            payout.getRecipientSlot(),
            payout.getRecipientUserId(),
            payout.getGrossAmount(),
            payout.getServiceFee(),
            payout.getAmount(),
            payout.getStatus(),
            payout.getCreatedAt()
        );
    }
}
