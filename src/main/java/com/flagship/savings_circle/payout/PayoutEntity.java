package com.flagship.savings_circle.payout;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "payouts")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PayoutEntity {

    @Id
    private UUID id;

    @Column(name = "group_id", nullable = false, updatable = false)
    private UUID groupId;

    @Column(name = "cycle_number", nullable = false, updatable = false)
    private int cycleNumber;

    @Column(name = "recipient_slot", nullable = false, updatable = false)
    private int recipientSlot;

    @Column(name = "recipient_user_id", updatable = false)
    private UUID recipientUserId;

    @Column(name = "gross_amount", nullable = false, updatable = false)
    private long grossAmount;

    @Column(name = "service_fee", nullable = false, updatable = false)
    private long serviceFee;

    @Column(nullable = false, updatable = false)
    private long amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private PayoutStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    static PayoutEntity of(UUID groupId, int cycleNumber, int recipientSlot, UUID recipientUserId,
                           PayoutCalculation calculation, Instant createdAt) {
        return new PayoutEntity(
            UUID.randomUUID(),
            groupId,
            cycleNumber,
            recipientSlot,
            recipientUserId,
            calculation.getGross(),
            calculation.getServiceFee(),
            calculation.getPayout(),
            recipientUserId != null ? PayoutStatus.CREDITED : PayoutStatus.UNCLAIMED,
            createdAt);
    }
}
