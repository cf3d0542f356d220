package com.flagship.savings_circle.cycle;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Cycle rows move only through the conditional updates below.
 * There is no in-memory notion of "current cycle" anywhere.
 */
@Repository
public interface ContributionCycleRepository extends JpaRepository<ContributionCycleEntity, UUID> {

    Optional<ContributionCycleEntity> findByGroupIdAndCycleNumber(UUID groupId, int cycleNumber);

    Optional<ContributionCycleEntity> findByGroupIdAndStatus(UUID groupId, CycleStatus status);

    List<ContributionCycleEntity> findByGroupIdOrderByCycleNumberAsc(UUID groupId);

    /**
     * Row lock taken before changing any contribution of the cycle, so that
     * concurrent payers see each other's PAID rows when checking completion.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM ContributionCycleEntity c WHERE c.groupId = :groupId AND c.cycleNumber = :cycleNumber")
    Optional<ContributionCycleEntity> lockByGroupIdAndCycleNumber(@Param("groupId") UUID groupId,
                                                                  @Param("cycleNumber") int cycleNumber);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(value = """
        INSERT INTO contribution_cycles (id, group_id, cycle_number, recipient_slot, status, collected_amount)
        VALUES (:id, :groupId, :cycleNumber, :cycleNumber, 'PENDING', 0)
        ON CONFLICT (group_id, cycle_number) DO NOTHING
        """, nativeQuery = true)
    int insertIfAbsent(@Param("id") UUID id, @Param("groupId") UUID groupId, @Param("cycleNumber") int cycleNumber);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(value = """
        UPDATE contribution_cycles
        SET status = 'ACTIVE', started_at = :now
        WHERE group_id = :groupId AND cycle_number = :cycleNumber AND status = 'PENDING'
        """, nativeQuery = true)
    int activate(@Param("groupId") UUID groupId, @Param("cycleNumber") int cycleNumber, @Param("now") Instant now);

    /**
     * ACTIVE → COMPLETED when every contribution of the cycle is PAID or WAIVED
     * and the group itself is ACTIVE. Stores the PAID total in the same statement.
     * Exactly one caller gets 1 back.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(value = """
        UPDATE contribution_cycles c
        SET status = 'COMPLETED',
            completed_at = :now,
            collected_amount = (
                SELECT COALESCE(SUM(p.amount), 0) FROM contributions p
                WHERE p.group_id = c.group_id AND p.cycle_number = c.cycle_number AND p.status = 'PAID')
        WHERE c.group_id = :groupId AND c.cycle_number = :cycleNumber AND c.status = 'ACTIVE'
          AND EXISTS (SELECT 1 FROM savings_groups g WHERE g.id = c.group_id AND g.status = 'ACTIVE')
          AND NOT EXISTS (
                SELECT 1 FROM contributions x
                WHERE x.group_id = c.group_id AND x.cycle_number = c.cycle_number
                  AND x.status NOT IN ('PAID', 'WAIVED'))
        """, nativeQuery = true)
    int completeIfSettled(@Param("groupId") UUID groupId, @Param("cycleNumber") int cycleNumber,
                          @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(value = """
        UPDATE contribution_cycles
        SET payout_amount = :payoutAmount, service_fee_collected = :serviceFee
        WHERE group_id = :groupId AND cycle_number = :cycleNumber
        """, nativeQuery = true)
    int recordPayout(@Param("groupId") UUID groupId, @Param("cycleNumber") int cycleNumber,
                     @Param("payoutAmount") long payoutAmount, @Param("serviceFee") long serviceFee);
}
