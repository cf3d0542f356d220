package com.flagship.savings_circle.cycle;

import com.flagship.savings_circle.event.CycleCompletedEvent;
import com.flagship.savings_circle.group.GroupEntity;
import com.flagship.savings_circle.group.GroupNotFoundException;
import com.flagship.savings_circle.group.GroupRepository;
import com.flagship.savings_circle.group.GroupStatus;
import com.flagship.savings_circle.observability.SettlementMetrics;
import com.flagship.savings_circle.outbox.OutboxService;
import com.flagship.savings_circle.payout.PayoutEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

/**
 * Moves a group through its rotation.
 *
 * Every step is a conditional update on the cycle or group row. Whoever flips
 * the row does the follow-up work; everybody else sees 0 rows and returns.
 * Any number of triggers (payments, waivers, the scheduled scan) may race here.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CycleScheduler {

    private final GroupRepository groupRepository;
    private final ContributionCycleRepository cycleRepository;
    private final ContributionRepository contributionRepository;
    private final PayoutEngine payoutEngine;
    private final OutboxService outboxService;
    private final SettlementMetrics metrics;
    private final Clock clock;

    /**
     * Lays out cycles 1..N for a group that just became ACTIVE and opens cycle 1.
     * Cycle-1 contributions paid on entry are moved to the start date.
     * Only the caller that won the FORMING → ACTIVE transition calls this.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void initializeCycles(UUID groupId) {
        GroupEntity group = loadGroup(groupId);
        if (group.getStartDate() == null) {
            throw new IllegalStateException("Group " + groupId + " has no start date; was it activated?");
        }
        Instant now = clock.instant();

        int created = 0;
        for (int cycle = 1; cycle <= group.getTotalSlots(); cycle++) {
            created += cycleRepository.insertIfAbsent(UUID.randomUUID(), groupId, cycle);
        }
        cycleRepository.activate(groupId, 1, now);
        LocalDate firstDueDate = group.getFrequency().dueDate(group.getStartDate(), 1);
        int rescheduled = contributionRepository.rescheduleCycle(groupId, 1, firstDueDate, now);
        int contributions = contributionRepository.insertPendingForActiveMembers(groupId, 1, firstDueDate, now);

        log.info("Cycles initialized for group {}: {} cycles created, cycle 1 active, {} new contributions, "
            + "{} entry contributions due {}", groupId, created, contributions, rescheduled, firstDueDate);
    }

    /**
     * Closes the cycle if every contribution is PAID or WAIVED, pays it out and
     * opens the next one (or completes the group after the last cycle).
     *
     * @return true if this call completed the cycle
     */
    @Transactional
    public boolean advanceIfComplete(UUID groupId, int cycleNumber) {
        Instant now = clock.instant();
        if (cycleRepository.completeIfSettled(groupId, cycleNumber, now) == 0) {
            return false;
        }

        GroupEntity group = loadGroup(groupId);
        ContributionCycleEntity completed = cycleRepository.findByGroupIdAndCycleNumber(groupId, cycleNumber)
            .orElseThrow(() -> new IllegalStateException("Cycle " + cycleNumber + " vanished in group " + groupId));
        boolean lastCycle = cycleNumber >= group.getTotalSlots();
        Integer nextCycle = lastCycle ? null : cycleNumber + 1;

        log.info("Cycle {} of group {} completed with {} collected",
            cycleNumber, groupId, completed.getCollectedAmount());
        outboxService.saveEvent(CycleCompletedEvent.of(groupId, cycleNumber, completed.getCollectedAmount(),
            nextCycle, now));
        metrics.recordCycleCompleted();

        payoutEngine.settle(groupId, cycleNumber);

        if (lastCycle) {
            int updated = groupRepository.transitionStatus(groupId, GroupStatus.ACTIVE.name(),
                GroupStatus.COMPLETED.name(), now);
            log.info("Group {} finished its rotation{}", groupId, updated == 1 ? "" : " (status already changed)");
        } else {
            openCycle(group, nextCycle, now);
        }
        return true;
    }

    private void openCycle(GroupEntity group, int cycleNumber, Instant now) {
        UUID groupId = group.getId();
        if (cycleRepository.activate(groupId, cycleNumber, now) == 0) {
            log.warn("Cycle {} of group {} was not PENDING, leaving it as is", cycleNumber, groupId);
        }
        LocalDate dueDate = group.getFrequency().dueDate(group.getStartDate(), cycleNumber);
        int contributions = contributionRepository.insertPendingForActiveMembers(groupId, cycleNumber, dueDate, now);
        groupRepository.advanceCurrentCycle(groupId, cycleNumber, now);
        log.info("Cycle {} of group {} opened: {} contributions due {}", cycleNumber, groupId, contributions, dueDate);
    }

    @Transactional(readOnly = true)
    public Optional<ContributionCycleEntity> findActiveCycle(UUID groupId) {
        return cycleRepository.findByGroupIdAndStatus(groupId, CycleStatus.ACTIVE);
    }

    private GroupEntity loadGroup(UUID groupId) {
        return groupRepository.findById(groupId).orElseThrow(() -> new GroupNotFoundException(groupId));
    }
}
