package com.flagship.savings_circle.cycle;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ContributionRepository extends JpaRepository<ContributionEntity, UUID> {

    List<ContributionEntity> findByGroupIdAndCycleNumberOrderByCreatedAtAsc(UUID groupId, int cycleNumber);

    List<ContributionEntity> findByGroupIdAndUserIdOrderByCycleNumberAsc(UUID groupId, UUID userId);

    Optional<ContributionEntity> findByMembershipIdAndCycleNumber(UUID membershipId, int cycleNumber);

    List<ContributionEntity> findByGroupIdAndStatus(UUID groupId, ContributionStatus status);

    @Query(value = """
        SELECT COALESCE(SUM(amount), 0) FROM contributions
        WHERE group_id = :groupId AND cycle_number = :cycleNumber AND status = 'PAID'
        """, nativeQuery = true)
    long sumPaid(@Param("groupId") UUID groupId, @Param("cycleNumber") int cycleNumber);

    /**
     * Cycle-1 contribution settled as part of the entry payment. The group has
     * no start date yet, so {@code dueDate} is provisional until its cycles are laid out.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(value = """
        INSERT INTO contributions (id, membership_id, group_id, user_id, cycle_number, amount, status,
                                   due_date, paid_at, payment_reference, created_at, updated_at)
        VALUES (:id, :membershipId, :groupId, :userId, :cycleNumber, :amount, 'PAID',
                :dueDate, :now, :reference, :now, :now)
        ON CONFLICT (membership_id, cycle_number) DO NOTHING
        """, nativeQuery = true)
    int insertPaid(@Param("id") UUID id,
                   @Param("membershipId") UUID membershipId,
                   @Param("groupId") UUID groupId,
                   @Param("userId") UUID userId,
                   @Param("cycleNumber") int cycleNumber,
                   @Param("amount") long amount,
                   @Param("dueDate") LocalDate dueDate,
                   @Param("reference") String reference,
                   @Param("now") Instant now);

    /**
     * A PENDING contribution for every ACTIVE member who has none for the cycle yet.
     *
     * @return number of contributions created
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(value = """
        INSERT INTO contributions (id, membership_id, group_id, user_id, cycle_number, amount, status,
                                   due_date, created_at, updated_at)
        SELECT gen_random_uuid(), m.id, m.group_id, m.user_id, :cycleNumber, g.contribution_amount, 'PENDING',
               :dueDate, :now, :now
        FROM memberships m
        JOIN savings_groups g ON g.id = m.group_id
        WHERE m.group_id = :groupId AND m.status = 'ACTIVE'
        ON CONFLICT (membership_id, cycle_number) DO NOTHING
        """, nativeQuery = true)
    int insertPendingForActiveMembers(@Param("groupId") UUID groupId,
                                      @Param("cycleNumber") int cycleNumber,
                                      @Param("dueDate") LocalDate dueDate,
                                      @Param("now") Instant now);

    /**
     * Moves a cycle's contributions to the due date fixed by the group's start date.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(value = """
        UPDATE contributions
        SET due_date = :dueDate, updated_at = :now
        WHERE group_id = :groupId AND cycle_number = :cycleNumber AND due_date <> :dueDate
        """, nativeQuery = true)
    int rescheduleCycle(@Param("groupId") UUID groupId,
                        @Param("cycleNumber") int cycleNumber,
                        @Param("dueDate") LocalDate dueDate,
                        @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(value = """
        UPDATE contributions
        SET status = 'PAID', paid_at = :now, payment_reference = :reference, updated_at = :now
        WHERE id = :id AND status IN ('PENDING', 'OVERDUE')
        """, nativeQuery = true)
    int markPaid(@Param("id") UUID id, @Param("reference") String reference, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(value = """
        UPDATE contributions
        SET status = 'WAIVED', updated_at = :now
        WHERE id = :id AND status IN ('PENDING', 'OVERDUE')
        """, nativeQuery = true)
    int waive(@Param("id") UUID id, @Param("now") Instant now);

    /**
     * PENDING → OVERDUE for a group's contributions due strictly before {@code asOf}.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(value = """
        UPDATE contributions
        SET status = 'OVERDUE', updated_at = :now
        WHERE group_id = :groupId AND status = 'PENDING' AND due_date < :asOf
        """, nativeQuery = true)
    int markOverdue(@Param("groupId") UUID groupId, @Param("asOf") LocalDate asOf, @Param("now") Instant now);

    @Query(value = """
        SELECT c.* FROM contributions c
        WHERE c.group_id = :groupId AND c.status = 'OVERDUE'
          AND NOT EXISTS (SELECT 1 FROM penalties p WHERE p.contribution_id = c.id)
        ORDER BY c.due_date, c.id
        """, nativeQuery = true)
    List<ContributionEntity> findOverdueWithoutPenalty(@Param("groupId") UUID groupId);
}
