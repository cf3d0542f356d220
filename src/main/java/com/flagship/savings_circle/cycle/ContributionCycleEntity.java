package com.flagship.savings_circle.cycle;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * One rotation round. Cycle n pays out to the member holding slot n.
 */
@Entity
@Table(name = "contribution_cycles")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ContributionCycleEntity {

    @Id
    private UUID id;

    @Column(name = "group_id", nullable = false)
    private UUID groupId;

    @Column(name = "cycle_number", nullable = false)
    private int cycleNumber;

    @Column(name = "recipient_slot", nullable = false)
    private int recipientSlot;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private CycleStatus status;

    @Column(name = "collected_amount", nullable = false)
    private long collectedAmount;

    @Column(name = "payout_amount")
    private Long payoutAmount;

    @Column(name = "service_fee_collected")
    private Long serviceFeeCollected;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;
}
