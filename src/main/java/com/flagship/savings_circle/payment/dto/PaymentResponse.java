package com.flagship.savings_circle.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.savings_circle.payment.EntryPayment;
import com.flagship.savings_circle.payment.PaymentRecord;
import com.flagship.savings_circle.payment.PurposeType;
import com.flagship.savings_circle.payment.RecurringContribution;
import com.flagship.savings_circle.payment.VerificationStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class PaymentResponse {

    @JsonProperty("reference")
    String reference;

    @JsonProperty("purpose")
    PurposeType purpose;

    @JsonProperty("group_id")
    UUID groupId;

    @JsonProperty("user_id")
    UUID userId;

    @JsonProperty("preferred_slot")
    Integer preferredSlot;

    @JsonProperty("contribution_id")
    UUID contributionId;

    @JsonProperty("cycle_number")
    Integer cycleNumber;

    @JsonProperty("amount")
    long amount;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("verification_status")
    VerificationStatus verificationStatus;

    @JsonProperty("processed")
    boolean processed;

    @JsonProperty("review_reason")
    String reviewReason;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("verified_at")
    Instant verifiedAt;

    @JsonProperty("processed_at")
    Instant processedAt;

    public static PaymentResponse from(PaymentRecord record) {
        PaymentResponseBuilder builder = PaymentResponse.builder()
            .reference(record.getReference())
            .purpose(record.getPurpose().type())
            .groupId(record.getPurpose().groupId())
            .userId(record.getPurpose().userId())
            .amount(record.getExpectedAmount())
            .currency(record.getCurrency())
            .verificationStatus(record.getVerificationStatus())
            .processed(record.isProcessed())
            .reviewReason(record.getReviewReason())
            .createdAt(record.getCreatedAt())
            .verifiedAt(record.getVerifiedAt())
            .processedAt(record.getProcessedAt());

        if (record.getPurpose() instanceof EntryPayment entry) {
            builder.preferredSlot(entry.preferredSlot());
        } else if (record.getPurpose() instanceof RecurringContribution contribution) {
            builder.contributionId(contribution.contributionId()).cycleNumber(contribution.cycleNumber());
        }
        return builder.build();
    }
}
