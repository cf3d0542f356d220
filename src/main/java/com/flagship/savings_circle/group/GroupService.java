package com.flagship.savings_circle.group;

import com.flagship.savings_circle.slot.SlotRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.UUID;

/**
 * Group creation and operator-driven lifecycle changes.
 *
 * Activation (FORMING → ACTIVE) and completion (ACTIVE → COMPLETED) are not
 * here: they are side effects of membership activation and cycle advancement.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GroupService {

    private static final BigDecimal DEFAULT_SERVICE_FEE = new BigDecimal("2.00");
    private static final BigDecimal DEFAULT_SECURITY_DEPOSIT = new BigDecimal("10.00");

    private final GroupRepository groupRepository;
    private final SlotRegistry slotRegistry;
    private final Clock clock;

    /**
     * Creates a FORMING group together with its slots 1..totalSlots.
     */
    @Transactional
    public GroupEntity createGroup(String name, long contributionAmount, Frequency frequency, int totalSlots,
                                   BigDecimal serviceFeePercentage, BigDecimal securityDepositPercentage,
                                   UUID createdBy) {
        if (contributionAmount <= 0) {
            throw new IllegalArgumentException("Contribution amount must be positive");
        }
        if (totalSlots < 2) {
            throw new IllegalArgumentException("A group needs at least 2 slots");
        }
        BigDecimal fee = serviceFeePercentage != null ? serviceFeePercentage : DEFAULT_SERVICE_FEE;
        BigDecimal deposit = securityDepositPercentage != null ? securityDepositPercentage : DEFAULT_SECURITY_DEPOSIT;

        GroupEntity group = groupRepository.save(GroupEntity.forming(
            name, contributionAmount, frequency, totalSlots, fee, deposit, createdBy));
        slotRegistry.createSlots(group.getId(), totalSlots);

        log.info("Group created: groupId={}, slots={}, contribution={}, frequency={}",
            group.getId(), totalSlots, contributionAmount, frequency);
        return group;
    }

    @Transactional(readOnly = true)
    public GroupEntity getGroup(UUID groupId) {
        return groupRepository.findById(groupId)
            .orElseThrow(() -> new GroupNotFoundException(groupId));
    }

    @Transactional
    public GroupEntity pause(UUID groupId) {
        return transition(groupId, GroupStatus.PAUSED);
    }

    /**
     * Returns a paused group to ACTIVE if its cycles had started, otherwise to FORMING.
     */
    @Transactional
    public GroupEntity resume(UUID groupId) {
        GroupEntity group = getGroup(groupId);
        if (group.getStatus() != GroupStatus.PAUSED) {
            throw new IllegalStateException(
                String.format("Cannot resume group %s in %s status", groupId, group.getStatus()));
        }
        return transition(groupId, group.getStartDate() != null ? GroupStatus.ACTIVE : GroupStatus.FORMING);
    }

    @Transactional
    public GroupEntity cancel(UUID groupId) {
        return transition(groupId, GroupStatus.CANCELLED);
    }

    private GroupEntity transition(UUID groupId, GroupStatus target) {
        GroupEntity group = getGroup(groupId);
        GroupStatus current = group.getStatus();
        if (current == target) {
            return group;
        }
        if (!current.canTransitionTo(target)) {
            throw new IllegalStateException(
                String.format("Cannot move group %s from %s to %s", groupId, current, target));
        }
        int updated = groupRepository.transitionStatus(groupId, current.name(), target.name(), clock.instant());
        if (updated == 0) {
            throw new IllegalStateException(
                String.format("Group %s changed status concurrently; expected %s", groupId, current));
        }
        log.info("Group status changed: groupId={}, {} -> {}", groupId, current, target);
        return getGroup(groupId);
    }
}
