package com.flagship.savings_circle.slot;

import com.flagship.savings_circle.group.Frequency;
import com.flagship.savings_circle.group.GroupEntity;
import com.flagship.savings_circle.payment.SettlementResult;
import com.flagship.savings_circle.support.AbstractIntegrationTest;
import com.flagship.savings_circle.support.TestClockConfiguration;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Slot reservation and assignment tests.
 *
 * These tests verify:
 * - Reservations expire lazily and the slot becomes selectable again
 * - Only one of several concurrent reservations of a slot wins
 * - An entry payment whose reservation was lost falls back to the lowest free slot
 */
class SlotRegistryTest extends AbstractIntegrationTest {

    private static final Duration TTL = Duration.ofMinutes(5);

    @Autowired
    private SlotRegistry slotRegistry;

    @Autowired
    private MeterRegistry meterRegistry;

    @Autowired
    private MockMvc mockMvc;

    @Test
    @DisplayName("An expired reservation should be takeable by another user")
    void testReservation_Expiry() {
        printTestHeader("Reservation Expiry");

        GroupEntity group = createGroup(3, 1000, Frequency.WEEKLY, "2.00");
        UUID alice = UUID.randomUUID();
        UUID bob = UUID.randomUUID();

        SlotReservation held = slotRegistry.reserveSlot(group.getId(), 2, alice, TTL);
        printOutput("Reserved until", held.getReservedUntil());
        assertEquals(TestClockConfiguration.DEFAULT_NOW.plus(TTL), held.getReservedUntil());

        assertThrows(SlotUnavailableException.class, () -> slotRegistry.reserveSlot(group.getId(), 2, bob, TTL));

        clock.advance(Duration.ofMinutes(6));
        SlotEntity lapsed = slotFor(group.getId(), 2);
        assertEquals(SlotStatus.AVAILABLE, lapsed.effectiveStatus(clock.instant()));

        SlotReservation taken = slotRegistry.reserveSlot(group.getId(), 2, bob, TTL);
        assertEquals(2, taken.getSlotNumber());
        assertEquals(bob, slotFor(group.getId(), 2).getReservedBy());

        printSuccess("Slot 2 passed from alice to bob after expiry");
    }

    @Test
    @DisplayName("Reserving any slot should pick the lowest selectable one")
    void testReservation_AnySlotPicksLowest() {
        printTestHeader("Any-Slot Reservation");

        GroupEntity group = createGroup(3, 1000, Frequency.WEEKLY, "2.00");
        slotRegistry.reserveSlot(group.getId(), 1, UUID.randomUUID(), TTL);

        SlotReservation any = slotRegistry.reserveSlot(group.getId(), null, UUID.randomUUID(), TTL);
        printOutput("Slot", any.getSlotNumber());
        assertEquals(2, any.getSlotNumber());

        slotRegistry.reserveSlot(group.getId(), null, UUID.randomUUID(), TTL);
        assertThrows(NoSlotsAvailableException.class,
            () -> slotRegistry.reserveSlot(group.getId(), null, UUID.randomUUID(), TTL));

        printSuccess("Lowest slot chosen, full group rejected");
    }

    @Test
    @DisplayName("A new reservation should release the user's other reservation")
    void testReservation_MovesUserHold() {
        printTestHeader("Reservation Moves");

        GroupEntity group = createGroup(3, 1000, Frequency.WEEKLY, "2.00");
        UUID userId = UUID.randomUUID();

        slotRegistry.reserveSlot(group.getId(), 1, userId, TTL);
        slotRegistry.reserveSlot(group.getId(), 3, userId, TTL);

        assertEquals(SlotStatus.AVAILABLE, slotFor(group.getId(), 1).getStatus());
        assertEquals(SlotStatus.RESERVED, slotFor(group.getId(), 3).getStatus());

        printSuccess("Only slot 3 still held");
    }

    @Test
    @DisplayName("Concurrent reservations of the same slot should produce exactly one winner")
    void testReservation_ConcurrentSameSlot() throws Exception {
        printTestHeader("Concurrent Reservation");

        GroupEntity group = createGroup(5, 1000, Frequency.WEEKLY, "2.00");
        int threads = 6;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger won = new AtomicInteger();
        AtomicInteger lost = new AtomicInteger();
        List<Throwable> unexpected = new ArrayList<>();

        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                try {
                    start.await();
                    slotRegistry.reserveSlot(group.getId(), 3, UUID.randomUUID(), TTL);
                    won.incrementAndGet();
                } catch (SlotUnavailableException e) {
                    lost.incrementAndGet();
                } catch (Throwable e) {
                    synchronized (unexpected) {
                        unexpected.add(e);
                    }
                }
            });
        }
        start.countDown();
        executor.shutdown();
        assertTrue(executor.awaitTermination(30, TimeUnit.SECONDS));

        printOutput("Won", won.get());
        printOutput("Lost", lost.get());
        assertTrue(unexpected.isEmpty(), "Unexpected failures: " + unexpected);
        assertEquals(1, won.get());
        assertEquals(threads - 1, lost.get());

        printSuccess("Exactly one reservation succeeded");
    }

    @Test
    @DisplayName("Entry payment whose reservation was taken should fall back to the lowest free slot")
    void testAssignment_FallbackAfterLostReservation() {
        printTestHeader("Assignment Fallback");

        gatewayPaysInFull();
        GroupEntity group = createGroup(3, 1000, Frequency.WEEKLY, "2.00");
        UUID alice = UUID.randomUUID();
        UUID bob = UUID.randomUUID();
        double fallbacksBefore = fallbackCount();

        slotRegistry.reserveSlot(group.getId(), 2, alice, TTL);
        String reference = initiateEntry(group.getId(), alice, 2).getReference();

        clock.advance(Duration.ofMinutes(10));
        slotRegistry.reserveSlot(group.getId(), 2, bob, TTL);

        SettlementResult result = settlementService.verifyAndSettle(reference);
        printOutput("Assigned slot", result.getSlotNumber());

        assertEquals(SettlementResult.Status.MEMBERSHIP_ACTIVATED, result.getStatus());
        assertEquals(1, result.getSlotNumber());
        assertEquals(alice, slotFor(group.getId(), 1).getAssignedTo());
        assertEquals(bob, slotFor(group.getId(), 2).getReservedBy());
        assertEquals(fallbacksBefore + 1, fallbackCount());

        printSuccess("Alice got slot 1, bob keeps slot 2");
    }

    @Test
    @DisplayName("Live reservation should be honoured when the entry payment settles")
    void testAssignment_HonoursLiveReservation() {
        printTestHeader("Assignment Honours Reservation");

        gatewayPaysInFull();
        GroupEntity group = createGroup(3, 1000, Frequency.WEEKLY, "2.00");
        UUID userId = UUID.randomUUID();

        slotRegistry.reserveSlot(group.getId(), 3, userId, TTL);
        SettlementResult result = joinWithSlot(group.getId(), userId, 3);

        assertEquals(3, result.getSlotNumber());
        SlotEntity slot = slotFor(group.getId(), 3);
        assertEquals(SlotStatus.ASSIGNED, slot.getStatus());
        assertNull(slot.getReservedBy());

        assertThrows(IllegalStateException.class,
            () -> slotRegistry.reserveSlot(group.getId(), 1, userId, TTL));

        printSuccess("Slot 3 assigned, further reservations refused");
    }

    @Test
    @DisplayName("Reservation endpoint should return 201 and then 409 for a held slot")
    void testReservationEndpoint() throws Exception {
        printTestHeader("Reservation Endpoint");

        GroupEntity group = createGroup(3, 1000, Frequency.WEEKLY, "2.00");
        UUID userId = UUID.randomUUID();
        String body = "{\"user_id\":\"" + userId + "\",\"slot_number\":2}";

        mockMvc.perform(post("/api/groups/{groupId}/slots/reservations", group.getId())
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.slot_number").value(2))
            .andExpect(jsonPath("$.user_id").value(userId.toString()));

        mockMvc.perform(post("/api/groups/{groupId}/slots/reservations", group.getId())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"user_id\":\"" + UUID.randomUUID() + "\",\"slot_number\":2}"))
            .andExpect(status().isConflict());

        mockMvc.perform(get("/api/groups/{groupId}/slots", group.getId()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(3))
            .andExpect(jsonPath("$[1].status").value("RESERVED"));

        printSuccess("Reservation endpoint behaves");
    }

    private SlotEntity slotFor(UUID groupId, int slotNumber) {
        return slotRegistry.getSlots(groupId).stream()
            .filter(s -> s.getSlotNumber() == slotNumber)
            .findFirst()
            .orElseThrow();
    }

    private double fallbackCount() {
        Counter counter = meterRegistry.find("slots.assignment.fallback").counter();
        return counter == null ? 0 : counter.count();
    }
}
