package com.flagship.savings_circle.group;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * JPA entity for a savings group.
 *
 * No setters: status, member count and current cycle only move through the
 * conditional updates in {@link GroupRepository}, never by dirty checking.
 * Amounts are in the currency's minor unit.
 */
@Entity
@Table(name = "savings_groups")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class GroupEntity {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(name = "contribution_amount", nullable = false, updatable = false)
    private long contributionAmount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private Frequency frequency;

    @Column(name = "total_slots", nullable = false, updatable = false)
    private int totalSlots;

    @Column(name = "service_fee_percentage", nullable = false, updatable = false, precision = 5, scale = 2)
    private BigDecimal serviceFeePercentage;

    @Column(name = "security_deposit_percentage", nullable = false, updatable = false, precision = 5, scale = 2)
    private BigDecimal securityDepositPercentage;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private GroupStatus status;

    @Column(name = "current_member_count", nullable = false)
    private int currentMemberCount;

    @Column(name = "current_cycle", nullable = false)
    private int currentCycle;

    @Column(name = "start_date")
    private LocalDate startDate;

    @Column(name = "created_by", nullable = false, updatable = false)
    private UUID createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    /**
     * Creates a new group in FORMING status with no members.
     */
    static GroupEntity forming(String name, long contributionAmount, Frequency frequency, int totalSlots,
                               BigDecimal serviceFeePercentage, BigDecimal securityDepositPercentage,
                               UUID createdBy) {
        return new GroupEntity(
            UUID.randomUUID(),
            name,
            contributionAmount,
            frequency,
            totalSlots,
            serviceFeePercentage,
            securityDepositPercentage,
            GroupStatus.FORMING,
            0,
            0,
            null,
            createdBy,
            null, // set by @PrePersist
            null
        );
    }

    /**
     * Security deposit charged once at entry, rounded down to the minor unit.
     */
    public long securityDepositAmount() {
        return BigDecimal.valueOf(contributionAmount)
            .multiply(securityDepositPercentage)
            .divide(HUNDRED, 0, RoundingMode.FLOOR)
            .longValueExact();
    }

    /**
     * Entry payment total: the security deposit plus the first contribution.
     */
    public long entryAmount() {
        return contributionAmount + securityDepositAmount();
    }

    public boolean isFull() {
        return currentMemberCount >= totalSlots;
    }
}
