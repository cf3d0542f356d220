package com.flagship.savings_circle.slot;

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

/**
 * JPA entity for one rotation position of a group.
 * Read-only from Java; transitions happen through {@link SlotRepository} conditional updates.
 */
@Entity
@Table(name = "group_slots")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SlotEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "group_id", nullable = false, updatable = false)
    private UUID groupId;

    @Column(name = "slot_number", nullable = false, updatable = false)
    private int slotNumber;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private SlotStatus status;

    @Column(name = "reserved_by")
    private UUID reservedBy;

    @Column(name = "reserved_until")
    private Instant reservedUntil;

    @Column(name = "assigned_to")
    private UUID assignedTo;

    @Column(name = "assigned_at")
    private Instant assignedAt;

    static SlotEntity available(UUID groupId, int slotNumber) {
        return new SlotEntity(UUID.randomUUID(), groupId, slotNumber, SlotStatus.AVAILABLE,
            null, null, null, null);
    }

    /**
     * Status as seen at {@code now}: a lapsed reservation reads as AVAILABLE.
     */
    public SlotStatus effectiveStatus(Instant now) {
        if (status == SlotStatus.RESERVED && reservedUntil != null && reservedUntil.isBefore(now)) {
            return SlotStatus.AVAILABLE;
        }
        return status;
    }

    public boolean isReservationLiveFor(UUID userId, Instant now) {
        return status == SlotStatus.RESERVED
            && userId.equals(reservedBy)
            && !reservedUntil.isBefore(now);
    }
}
