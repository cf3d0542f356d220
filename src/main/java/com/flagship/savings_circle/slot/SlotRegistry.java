package com.flagship.savings_circle.slot;

import com.flagship.savings_circle.group.GroupEntity;
import com.flagship.savings_circle.group.GroupNotFoundException;
import com.flagship.savings_circle.group.GroupRepository;
import com.flagship.savings_circle.group.GroupStatus;
import com.flagship.savings_circle.observability.SettlementMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.IntStream;

/**
 * Tracks the fixed set of rotation positions of each group.
 *
 * Key rules:
 * - Every transition is a compare-and-set on the slot row, never read-then-write
 * - "Any slot" always means the lowest-numbered selectable slot
 * - Expired reservations are selectable; expiry is checked on every allocation, there is no sweeper
 * - Assignment commits in its own transaction so it survives a failed activation
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SlotRegistry {

    private final SlotRepository slotRepository;
    private final GroupRepository groupRepository;
    private final SettlementMetrics metrics;
    private final Clock clock;

    /**
     * Creates slots 1..totalSlots, all AVAILABLE, for a freshly created group.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void createSlots(UUID groupId, int totalSlots) {
        List<SlotEntity> slots = IntStream.rangeClosed(1, totalSlots)
            .mapToObj(n -> SlotEntity.available(groupId, n))
            .toList();
        slotRepository.saveAll(slots);
        log.debug("Created {} slots for group {}", totalSlots, groupId);
    }

    /**
     * Reserves a slot for a join request.
     *
     * @param slotNumber explicit slot, or null for the lowest selectable slot
     * @throws SlotUnavailableException if the explicit slot is held by someone else
     * @throws NoSlotsAvailableException if "any" finds nothing selectable
     * @throws IllegalStateException if the group is not forming or the user already holds a slot
     */
    @Transactional
    public SlotReservation reserveSlot(UUID groupId, Integer slotNumber, UUID userId, Duration ttl) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("Reservation ttl must be positive");
        }
        GroupEntity group = groupRepository.findById(groupId)
            .orElseThrow(() -> new GroupNotFoundException(groupId));
        if (group.getStatus() != GroupStatus.FORMING) {
            throw new IllegalStateException(
                String.format("Group %s is %s; slots can only be reserved while forming", groupId, group.getStatus()));
        }
        if (slotRepository.findByGroupIdAndAssignedTo(groupId, userId).isPresent()) {
            throw new IllegalStateException(
                String.format("User %s already holds a slot in group %s", userId, groupId));
        }

        Instant now = clock.instant();
        Instant until = now.plus(ttl);

        int reserved;
        if (slotNumber != null) {
            validateSlotNumber(group, slotNumber);
            if (slotRepository.reserve(groupId, slotNumber, userId, until, now) == 0) {
                metrics.recordSlotReservation("unavailable");
                throw new SlotUnavailableException(groupId, slotNumber);
            }
            reserved = slotNumber;
        } else {
            reserved = reserveLowest(groupId, userId, until, now);
        }

        slotRepository.releaseOtherReservations(groupId, userId, reserved);
        metrics.recordSlotReservation("reserved");
        log.info("Slot reserved: groupId={}, slot={}, userId={}, until={}", groupId, reserved, userId, until);
        return new SlotReservation(groupId, reserved, userId, until);
    }

    private int reserveLowest(UUID groupId, UUID userId, Instant until, Instant now) {
        for (Integer candidate : slotRepository.findSelectableSlotNumbers(groupId, now)) {
            if (slotRepository.reserve(groupId, candidate, userId, until, now) == 1) {
                return candidate;
            }
            log.debug("Lost race for slot {} in group {}, trying next", candidate, groupId);
        }
        metrics.recordSlotReservation("none_available");
        throw new NoSlotsAvailableException(groupId);
    }

    /**
     * Converts the user's hold into an assignment.
     *
     * Order of preference:
     * 1. A slot already assigned to this user (makes retries converge)
     * 2. The preferred slot, if the user's reservation on it is live or nobody holds it
     * 3. The user's other live reservation, when no preference was recorded
     * 4. The lowest selectable slot
     *
     * A lost compare-and-set re-reads the user's assignment first, so a concurrent
     * settlement for the same payer returns the slot the other one took.
     *
     * Runs in its own transaction: an assignment is durable even if the caller rolls back.
     *
     * @return the assigned slot number
     * @throws NoSlotsAvailableException if the group is full
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int assignSlot(UUID groupId, Integer preferredSlot, UUID userId) {
        Optional<SlotEntity> existing = slotRepository.findByGroupIdAndAssignedTo(groupId, userId);
        if (existing.isPresent()) {
            log.info("User {} already assigned slot {} in group {}", userId, existing.get().getSlotNumber(), groupId);
            return existing.get().getSlotNumber();
        }

        Instant now = clock.instant();
        List<Integer> attempts = new ArrayList<>();

        if (preferredSlot != null) {
            if (slotRepository.assignReserved(groupId, preferredSlot, userId, now) == 1
                    || slotRepository.assignSelectable(groupId, preferredSlot, userId, now) == 1) {
                return finishAssignment(groupId, preferredSlot, userId);
            }
            Optional<Integer> concurrent = findAssignedSlot(groupId, userId);
            if (concurrent.isPresent()) {
                return concurrent.get();
            }
            attempts.add(preferredSlot);
            metrics.recordSlotFallback();
            log.warn("Preferred slot {} in group {} no longer held by user {}, falling back to any slot",
                preferredSlot, groupId, userId);
        } else {
            Optional<Integer> live = slotRepository.findLiveReservation(groupId, userId, now);
            if (live.isPresent() && slotRepository.assignReserved(groupId, live.get(), userId, now) == 1) {
                return finishAssignment(groupId, live.get(), userId);
            }
        }

        for (Integer candidate : slotRepository.findSelectableSlotNumbers(groupId, now)) {
            if (attempts.contains(candidate)) {
                continue;
            }
            if (slotRepository.assignSelectable(groupId, candidate, userId, now) == 1) {
                return finishAssignment(groupId, candidate, userId);
            }
            Optional<Integer> concurrent = findAssignedSlot(groupId, userId);
            if (concurrent.isPresent()) {
                return concurrent.get();
            }
        }

        throw new NoSlotsAvailableException(groupId);
    }

    /**
     * The slot currently assigned to the user in the group, if any.
     */
    @Transactional(readOnly = true)
    public Optional<Integer> findAssignedSlot(UUID groupId, UUID userId) {
        return slotRepository.findByGroupIdAndAssignedTo(groupId, userId).map(SlotEntity::getSlotNumber);
    }

    private int finishAssignment(UUID groupId, int slotNumber, UUID userId) {
        slotRepository.releaseOtherReservations(groupId, userId, slotNumber);
        log.info("Slot assigned: groupId={}, slot={}, userId={}", groupId, slotNumber, userId);
        return slotNumber;
    }

    /**
     * RESERVED → AVAILABLE. Does nothing if the slot is not reserved.
     *
     * @return true if a reservation was released
     */
    @Transactional
    public boolean releaseSlot(UUID groupId, int slotNumber) {
        boolean released = slotRepository.release(groupId, slotNumber) == 1;
        if (released) {
            log.info("Slot reservation released: groupId={}, slot={}", groupId, slotNumber);
        }
        return released;
    }

    @Transactional(readOnly = true)
    public List<SlotEntity> getSlots(UUID groupId) {
        if (!groupRepository.existsById(groupId)) {
            throw new GroupNotFoundException(groupId);
        }
        return slotRepository.findByGroupIdOrderBySlotNumberAsc(groupId);
    }

    public Instant now() {
        return clock.instant();
    }

    private void validateSlotNumber(GroupEntity group, int slotNumber) {
        if (slotNumber < 1 || slotNumber > group.getTotalSlots()) {
            throw new IllegalArgumentException(
                String.format("Slot number must be between 1 and %d, got %d", group.getTotalSlots(), slotNumber));
        }
    }
}
