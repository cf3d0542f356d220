package com.flagship.savings_circle.membership;

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
public interface MembershipRepository extends JpaRepository<MembershipEntity, UUID> {

    Optional<MembershipEntity> findByGroupIdAndUserId(UUID groupId, UUID userId);

    List<MembershipEntity> findByGroupIdAndStatusOrderBySlotNumberAsc(UUID groupId, MembershipStatus status);

    Optional<MembershipEntity> findByGroupIdAndSlotNumberAndStatus(UUID groupId, int slotNumber, MembershipStatus status);

    boolean existsByGroupIdAndUserIdAndStatus(UUID groupId, UUID userId, MembershipStatus status);

    /**
     * Creates the membership as ACTIVE, or re-activates a non-active one.
     * An already ACTIVE membership is left alone and the call returns 0.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(value = """
        INSERT INTO memberships (id, group_id, user_id, slot_number, has_paid_entry, status,
                                 activation_reference, joined_at, updated_at)
        VALUES (:id, :groupId, :userId, :slotNumber, TRUE, 'ACTIVE', :reference, :now, :now)
        ON CONFLICT (group_id, user_id) DO UPDATE
        SET slot_number = EXCLUDED.slot_number,
            has_paid_entry = TRUE,
            status = 'ACTIVE',
            activation_reference = EXCLUDED.activation_reference,
            updated_at = EXCLUDED.updated_at
        WHERE memberships.status <> 'ACTIVE'
        """, nativeQuery = true)
    int upsertActive(@Param("id") UUID id,
                     @Param("groupId") UUID groupId,
                     @Param("userId") UUID userId,
                     @Param("slotNumber") int slotNumber,
                     @Param("reference") String reference,
                     @Param("now") Instant now);
}
