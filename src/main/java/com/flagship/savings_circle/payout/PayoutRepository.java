package com.flagship.savings_circle.payout;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PayoutRepository extends JpaRepository<PayoutEntity, UUID> {

    Optional<PayoutEntity> findByGroupIdAndCycleNumber(UUID groupId, int cycleNumber);

    List<PayoutEntity> findByGroupIdOrderByCycleNumberAsc(UUID groupId);
}
