package com.flagship.savings_circle.penalty;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PenaltyRepository extends JpaRepository<PenaltyEntity, UUID> {

    Optional<PenaltyEntity> findByContributionId(UUID contributionId);

    List<PenaltyEntity> findByGroupIdOrderByCreatedAtAsc(UUID groupId);

    @Query("""
        SELECT p.amount FROM PenaltyEntity p
        WHERE p.contributionId = :contributionId
          AND p.status = com.flagship.savings_circle.penalty.PenaltyStatus.APPLIED
        """)
    Optional<Long> findAppliedAmount(@Param("contributionId") UUID contributionId);

    /**
     * @return 1 if created, 0 if the contribution already carries a penalty
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(value = """
        INSERT INTO penalties (id, contribution_id, group_id, user_id, amount, type, reason, status, created_at)
        VALUES (:id, :contributionId, :groupId, :userId, :amount, :type, :reason, 'APPLIED', :now)
        ON CONFLICT (contribution_id) DO NOTHING
        """, nativeQuery = true)
    int insertIfAbsent(@Param("id") UUID id,
                       @Param("contributionId") UUID contributionId,
                       @Param("groupId") UUID groupId,
                       @Param("userId") UUID userId,
                       @Param("amount") long amount,
                       @Param("type") String type,
                       @Param("reason") String reason,
                       @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(value = """
        UPDATE penalties SET status = 'PAID', resolved_at = :now
        WHERE contribution_id = :contributionId AND status = 'APPLIED'
        """, nativeQuery = true)
    int markPaid(@Param("contributionId") UUID contributionId, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(value = """
        UPDATE penalties SET status = 'WAIVED', resolved_at = :now
        WHERE contribution_id = :contributionId AND status = 'APPLIED'
        """, nativeQuery = true)
    int waive(@Param("contributionId") UUID contributionId, @Param("now") Instant now);
}
