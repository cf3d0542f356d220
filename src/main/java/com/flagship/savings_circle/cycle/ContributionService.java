package com.flagship.savings_circle.cycle;

import com.flagship.savings_circle.group.GroupNotFoundException;
import com.flagship.savings_circle.group.GroupRepository;
import com.flagship.savings_circle.penalty.PenaltyRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Contribution queries and the operator waiver.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContributionService {

    private final GroupRepository groupRepository;
    private final ContributionRepository contributionRepository;
    private final ContributionCycleRepository cycleRepository;
    private final PenaltyRepository penaltyRepository;
    private final CycleScheduler cycleScheduler;
    private final Clock clock;

    @Transactional(readOnly = true)
    public ContributionEntity getContribution(UUID contributionId) {
        return contributionRepository.findById(contributionId)
            .orElseThrow(() -> new ContributionNotFoundException(contributionId));
    }

    /**
     * The APPLIED penalty on a contribution, or 0.
     */
    @Transactional(readOnly = true)
    public long outstandingPenalty(UUID contributionId) {
        return penaltyRepository.findAppliedAmount(contributionId).orElse(0L);
    }

    @Transactional(readOnly = true)
    public List<ContributionCycleEntity> getCycles(UUID groupId) {
        requireGroup(groupId);
        return cycleRepository.findByGroupIdOrderByCycleNumberAsc(groupId);
    }

    @Transactional(readOnly = true)
    public List<ContributionEntity> getContributions(UUID groupId, int cycleNumber) {
        requireGroup(groupId);
        return contributionRepository.findByGroupIdAndCycleNumberOrderByCreatedAtAsc(groupId, cycleNumber);
    }

    @Transactional(readOnly = true)
    public List<ContributionEntity> getContributionsForUser(UUID groupId, UUID userId) {
        requireGroup(groupId);
        return contributionRepository.findByGroupIdAndUserIdOrderByCycleNumberAsc(groupId, userId);
    }

    /**
     * PENDING|OVERDUE → WAIVED, waiving any APPLIED penalty, then tries to close the cycle.
     * Waiving an already waived contribution is a no-op.
     *
     * @throws IllegalStateException if the contribution is already PAID
     */
    @Transactional
    public ContributionEntity waive(UUID contributionId) {
        ContributionEntity contribution = getContribution(contributionId);
        cycleRepository.lockByGroupIdAndCycleNumber(contribution.getGroupId(), contribution.getCycleNumber())
            .orElseThrow(() -> new IllegalStateException(
                "Cycle " + contribution.getCycleNumber() + " does not exist in group " + contribution.getGroupId()));

        Instant now = clock.instant();
        if (contributionRepository.waive(contributionId, now) == 0) {
            ContributionEntity current = getContribution(contributionId);
            if (current.getStatus() == ContributionStatus.WAIVED) {
                return current;
            }
            throw new IllegalStateException(
                String.format("Contribution %s is %s and cannot be waived", contributionId, current.getStatus()));
        }
        penaltyRepository.waive(contributionId, now);
        log.info("Contribution {} (group {}, cycle {}) waived",
            contributionId, contribution.getGroupId(), contribution.getCycleNumber());

        cycleScheduler.advanceIfComplete(contribution.getGroupId(), contribution.getCycleNumber());
        return getContribution(contributionId);
    }

    private void requireGroup(UUID groupId) {
        if (!groupRepository.existsById(groupId)) {
            throw new GroupNotFoundException(groupId);
        }
    }
}
