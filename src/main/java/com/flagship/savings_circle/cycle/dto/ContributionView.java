package com.flagship.savings_circle.cycle.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.savings_circle.cycle.ContributionEntity;
import com.flagship.savings_circle.cycle.ContributionStatus;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
public class ContributionView {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("user_id")
    UUID userId;

    @JsonProperty("cycle_number")
    int cycleNumber;

    @JsonProperty("amount")
    long amount;

    @JsonProperty("status")
    ContributionStatus status;

    @JsonProperty("due_date")
    LocalDate dueDate;

    @JsonProperty("paid_at")
    Instant paidAt;

    @JsonProperty("payment_reference")
    String paymentReference;

    public static ContributionView from(ContributionEntity contribution) {
        return new ContributionView(
            contribution.getId(),
            contribution.getUserId(),
            contribution.getCycleNumber(),
            contribution.getAmount(),
            contribution.getStatus(),
            contribution.getDueDate(),
            contribution.getPaidAt(),
            contribution.getPaymentReference()
        );
    }
}
