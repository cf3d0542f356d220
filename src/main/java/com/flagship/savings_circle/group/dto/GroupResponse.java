package com.flagship.savings_circle.group.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.savings_circle.group.Frequency;
import com.flagship.savings_circle.group.GroupEntity;
import com.flagship.savings_circle.group.GroupStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class GroupResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("name")
    String name;

    @JsonProperty("contribution_amount")
    long contributionAmount;

    @JsonProperty("entry_amount")
    long entryAmount;

    @JsonProperty("frequency")
    Frequency frequency;

    @JsonProperty("total_slots")
    int totalSlots;

    @JsonProperty("current_member_count")
    int currentMemberCount;

    @JsonProperty("service_fee_percentage")
    BigDecimal serviceFeePercentage;

    @JsonProperty("security_deposit_percentage")
    BigDecimal securityDepositPercentage;

    @JsonProperty("status")
    GroupStatus status;

    @JsonProperty("current_cycle")
    int currentCycle;

    @JsonProperty("start_date")
    LocalDate startDate;

    public static GroupResponse from(GroupEntity group) {
        return GroupResponse.builder()
            .id(group.getId())
            .name(group.getName())
            .contributionAmount(group.getContributionAmount())
            .entryAmount(group.entryAmount())
            .frequency(group.getFrequency())
            .totalSlots(group.getTotalSlots())
            .currentMemberCount(group.getCurrentMemberCount())
            .serviceFeePercentage(group.getServiceFeePercentage())
            .securityDepositPercentage(group.getSecurityDepositPercentage())
            .status(group.getStatus())
            .currentCycle(group.getCurrentCycle())
            .startDate(group.getStartDate())
            .build();
    }
}
