package com.flagship.savings_circle.group;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Repository for savings groups.
 *
 * Every state change is a single-row conditional update; callers inspect the
 * affected row count to learn whether they won the transition.
 */
@Repository
public interface GroupRepository extends JpaRepository<GroupEntity, UUID> {

    List<GroupEntity> findByStatus(GroupStatus status);

    /**
     * Adds one member while the group is forming and not yet full.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(value = """
        UPDATE savings_groups
        SET current_member_count = current_member_count + 1, updated_at = :now
        WHERE id = :groupId AND status = 'FORMING' AND current_member_count < total_slots
        """, nativeQuery = true)
    int incrementMemberCount(@Param("groupId") UUID groupId, @Param("now") Instant now);

    /**
     * One-way FORMING → ACTIVE transition, only once every slot has a member.
     * Exactly one caller sees 1 here, and only that caller initializes cycles.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(value = """
        UPDATE savings_groups
        SET status = 'ACTIVE', start_date = :startDate, current_cycle = 1, updated_at = :now
        WHERE id = :groupId AND status = 'FORMING' AND current_member_count = total_slots
        """, nativeQuery = true)
    int activateIfFull(@Param("groupId") UUID groupId,
                       @Param("startDate") LocalDate startDate,
                       @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(value = """
        UPDATE savings_groups
        SET status = :target, updated_at = :now
        WHERE id = :groupId AND status = :expected
        """, nativeQuery = true)
    int transitionStatus(@Param("groupId") UUID groupId,
                         @Param("expected") String expected,
                         @Param("target") String target,
                         @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(value = """
        UPDATE savings_groups
        SET current_cycle = :cycleNumber, updated_at = :now
        WHERE id = :groupId AND current_cycle < :cycleNumber
        """, nativeQuery = true)
    int advanceCurrentCycle(@Param("groupId") UUID groupId,
                            @Param("cycleNumber") int cycleNumber,
                            @Param("now") Instant now);
}
