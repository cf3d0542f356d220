package com.flagship.savings_circle.slot;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for group slots.
 *
 * Reservation and assignment are compare-and-set updates on the slot's current
 * status. A caller that loses a race sees 0 rows and must not assume ownership.
 */
@Repository
public interface SlotRepository extends JpaRepository<SlotEntity, UUID> {

    List<SlotEntity> findByGroupIdOrderBySlotNumberAsc(UUID groupId);

    Optional<SlotEntity> findByGroupIdAndSlotNumber(UUID groupId, int slotNumber);

    Optional<SlotEntity> findByGroupIdAndAssignedTo(UUID groupId, UUID assignedTo);

    /**
     * Slot numbers that can be taken right now, lowest first.
     */
    @Query(value = """
        SELECT slot_number FROM group_slots
        WHERE group_id = :groupId
          AND (status = 'AVAILABLE' OR (status = 'RESERVED' AND reserved_until < :now))
        ORDER BY slot_number ASC
        """, nativeQuery = true)
    List<Integer> findSelectableSlotNumbers(@Param("groupId") UUID groupId, @Param("now") Instant now);

    /**
     * The slot this user currently holds under an unexpired reservation, if any.
     */
    @Query(value = """
        SELECT slot_number FROM group_slots
        WHERE group_id = :groupId AND status = 'RESERVED'
          AND reserved_by = :userId AND reserved_until >= :now
        ORDER BY slot_number ASC
        LIMIT 1
        """, nativeQuery = true)
    Optional<Integer> findLiveReservation(@Param("groupId") UUID groupId,
                                          @Param("userId") UUID userId,
                                          @Param("now") Instant now);

    /**
     * Reserves a slot that is free, lapsed, or already reserved by the same user (refreshes expiry).
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(value = """
        UPDATE group_slots
        SET status = 'RESERVED', reserved_by = :userId, reserved_until = :until
        WHERE group_id = :groupId AND slot_number = :slotNumber
          AND (status = 'AVAILABLE'
               OR (status = 'RESERVED' AND (reserved_until < :now OR reserved_by = :userId)))
        """, nativeQuery = true)
    int reserve(@Param("groupId") UUID groupId,
                @Param("slotNumber") int slotNumber,
                @Param("userId") UUID userId,
                @Param("until") Instant until,
                @Param("now") Instant now);

    /**
     * RESERVED → ASSIGNED for the reserving user while the reservation is live.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(value = """
        UPDATE group_slots
        SET status = 'ASSIGNED', assigned_to = :userId, assigned_at = :now,
            reserved_by = NULL, reserved_until = NULL
        WHERE group_id = :groupId AND slot_number = :slotNumber
          AND status = 'RESERVED' AND reserved_by = :userId AND reserved_until >= :now
        """, nativeQuery = true)
    int assignReserved(@Param("groupId") UUID groupId,
                       @Param("slotNumber") int slotNumber,
                       @Param("userId") UUID userId,
                       @Param("now") Instant now);

    /**
     * Assigns a slot nobody holds: AVAILABLE, or RESERVED with a lapsed expiry.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(value = """
        UPDATE group_slots
        SET status = 'ASSIGNED', assigned_to = :userId, assigned_at = :now,
            reserved_by = NULL, reserved_until = NULL
        WHERE group_id = :groupId AND slot_number = :slotNumber
          AND (status = 'AVAILABLE' OR (status = 'RESERVED' AND reserved_until < :now))
        """, nativeQuery = true)
    int assignSelectable(@Param("groupId") UUID groupId,
                         @Param("slotNumber") int slotNumber,
                         @Param("userId") UUID userId,
                         @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(value = """
        UPDATE group_slots
        SET status = 'AVAILABLE', reserved_by = NULL, reserved_until = NULL
        WHERE group_id = :groupId AND slot_number = :slotNumber AND status = 'RESERVED'
        """, nativeQuery = true)
    int release(@Param("groupId") UUID groupId, @Param("slotNumber") int slotNumber);

    /**
     * Drops every reservation the user holds in the group except {@code keepSlot}.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(value = """
        UPDATE group_slots
        SET status = 'AVAILABLE', reserved_by = NULL, reserved_until = NULL
        WHERE group_id = :groupId AND status = 'RESERVED'
          AND reserved_by = :userId AND slot_number <> :keepSlot
        """, nativeQuery = true)
    int releaseOtherReservations(@Param("groupId") UUID groupId,
                                 @Param("userId") UUID userId,
                                 @Param("keepSlot") int keepSlot);
}
