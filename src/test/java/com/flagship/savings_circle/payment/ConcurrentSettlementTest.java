package com.flagship.savings_circle.payment;

import com.flagship.savings_circle.cycle.ContributionEntity;
import com.flagship.savings_circle.cycle.ContributionRepository;
import com.flagship.savings_circle.cycle.CycleScheduler;
import com.flagship.savings_circle.gateway.WebhookSignatureVerifier;
import com.flagship.savings_circle.group.Frequency;
import com.flagship.savings_circle.group.GroupEntity;
import com.flagship.savings_circle.group.GroupStatus;
import com.flagship.savings_circle.membership.MembershipEntity;
import com.flagship.savings_circle.membership.MembershipRepository;
import com.flagship.savings_circle.membership.MembershipStatus;
import com.flagship.savings_circle.payout.PayoutEntity;
import com.flagship.savings_circle.payout.PayoutRepository;
import com.flagship.savings_circle.support.AbstractIntegrationTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;

/**
 * Concurrency tests for settlement.
 *
 * These tests verify:
 * - A verify call and a webhook racing on one reference apply it once
 * - Payers competing for one slot both end up with distinct slots
 * - Concurrent entries activate the group exactly once
 * - Concurrent final contributions complete the cycle and pay out once
 */
class ConcurrentSettlementTest extends AbstractIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private WebhookSignatureVerifier signatureVerifier;

    @Autowired
    private MembershipRepository membershipRepository;

    @Autowired
    private ContributionRepository contributionRepository;

    @Autowired
    private CycleScheduler cycleScheduler;

    @Autowired
    private PayoutRepository payoutRepository;

    @BeforeEach
    void stubGateway() {
        gatewayPaysInFull();
    }

    @Test
    @DisplayName("Verify call and webhook racing on one entry payment should activate one membership")
    void testVerifyAndWebhook_Race() throws Exception {
        printTestHeader("Race: Verify vs Webhook");

        GroupEntity group = createGroup(3, 1000, Frequency.WEEKLY, "2.00");
        UUID userId = UUID.randomUUID();
        PaymentRecord entry = initiateEntry(group.getId(), userId, 2);
        String body = "{\"event\":\"charge.success\",\"data\":{\"reference\":\"" + entry.getReference()
            + "\",\"amount\":" + entry.getExpectedAmount() + "}}";
        String signature = signatureVerifier.sign(body);
        printInput("Reference", entry.getReference());

        List<Object> outcomes = runConcurrently(List.of(
            () -> settlementService.verifyAndSettle(entry.getReference()).getStatus(),
            () -> mockMvc.perform(post("/api/webhooks/gateway")
                    .contentType(MediaType.APPLICATION_JSON)
                    .header("x-paystack-signature", signature)
                    .content(body))
                .andReturn()
                .getResponse()
                .getStatus()));
        printOutput("Outcomes", outcomes);

        assertEquals(200, outcomes.get(1));

        List<MembershipEntity> memberships = membershipRepository.findByGroupIdAndStatusOrderBySlotNumberAsc(
            group.getId(), MembershipStatus.ACTIVE);
        assertEquals(1, memberships.size(), "Exactly one membership should exist");
        assertEquals(userId, memberships.get(0).getUserId());
        assertEquals(2, memberships.get(0).getSlotNumber());
        assertEquals(1, contributionRepository.findByGroupIdAndUserIdOrderByCycleNumberAsc(group.getId(), userId).size());
        assertEquals(1, groupService.getGroup(group.getId()).getCurrentMemberCount());

        PaymentRecord record = paymentLedger.getByReference(entry.getReference());
        assertTrue(record.isProcessed());
        assertFalse(record.isFlaggedForReview());

        printSuccess("One membership, payment processed once");
    }

    @Test
    @DisplayName("Two payers preferring the same slot should both join on distinct slots")
    void testSamePreferredSlot_FallsBack() throws Exception {
        printTestHeader("Race: Same Preferred Slot");

        GroupEntity group = createGroup(3, 1000, Frequency.WEEKLY, "2.00");
        PaymentRecord first = initiateEntry(group.getId(), UUID.randomUUID(), 1);
        PaymentRecord second = initiateEntry(group.getId(), UUID.randomUUID(), 1);

        List<SettlementResult> outcomes = asResults(runConcurrently(List.of(
            () -> settlementService.verifyAndSettle(first.getReference()),
            () -> settlementService.verifyAndSettle(second.getReference()))));
        printOutput("Slots", outcomes.stream().map(SettlementResult::getSlotNumber).toList());

        assertTrue(outcomes.stream().allMatch(r -> r.getStatus() == SettlementResult.Status.MEMBERSHIP_ACTIVATED));
        assertEquals(Set.of(1, 2), outcomes.stream().map(SettlementResult::getSlotNumber).collect(Collectors.toSet()));
        assertEquals(2, groupService.getGroup(group.getId()).getCurrentMemberCount());

        printSuccess("Loser fell back to slot 2");
    }

    @Test
    @DisplayName("Concurrent entries filling the group should activate it exactly once")
    void testConcurrentFill_ActivatesOnce() throws Exception {
        printTestHeader("Race: Concurrent Fill");

        GroupEntity group = createGroup(4, 500, Frequency.DAILY, "2.00");
        List<Callable<Object>> tasks = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            PaymentRecord entry = initiateEntry(group.getId(), UUID.randomUUID(), null);
            tasks.add(() -> settlementService.verifyAndSettle(entry.getReference()));
        }

        List<SettlementResult> outcomes = asResults(runConcurrently(tasks));

        assertEquals(1, outcomes.stream().filter(SettlementResult::isGroupActivated).count(),
            "Exactly one entry should activate the group");
        assertEquals(Set.of(1, 2, 3, 4),
            outcomes.stream().map(SettlementResult::getSlotNumber).collect(Collectors.toSet()));
        GroupEntity active = groupService.getGroup(group.getId());
        printOutput("Group status", active.getStatus());
        assertEquals(GroupStatus.ACTIVE, active.getStatus());
        assertEquals(1, active.getCurrentCycle());

        printSuccess("Group activated once with four distinct slots");
    }

    @Test
    @DisplayName("Concurrent final contributions should complete the cycle and pay out once")
    void testConcurrentContributions_CompleteCycleOnce() throws Exception {
        printTestHeader("Race: Final Contributions");

        GroupEntity group = createGroup(3, 1000, Frequency.WEEKLY, "10.00");
        List<UUID> members = fillGroup(group);
        cycleScheduler.advanceIfComplete(group.getId(), 1);

        List<Callable<Object>> tasks = new ArrayList<>();
        for (UUID member : members) {
            ContributionEntity contribution = contributionFor(group.getId(), member, 2);
            PaymentRecord record = initiateContribution(group.getId(), member, contribution.getId());
            tasks.add(() -> settlementService.verifyAndSettle(record.getReference()));
        }

        List<SettlementResult> outcomes = asResults(runConcurrently(tasks));
        printOutput("Statuses", outcomes.stream().map(SettlementResult::getStatus).toList());

        assertTrue(outcomes.stream().allMatch(r -> r.getStatus() == SettlementResult.Status.CONTRIBUTION_PAID));
        assertEquals(1, outcomes.stream().filter(SettlementResult::isCycleCompleted).count());
        PayoutEntity payout = payoutRepository.findByGroupIdAndCycleNumber(group.getId(), 2).orElseThrow();
        assertEquals(2700, payout.getAmount());
        assertEquals(3, groupService.getGroup(group.getId()).getCurrentCycle());

        printSuccess("Cycle 2 completed once");
    }

    @Test
    @DisplayName("Repeated concurrent verification of one contribution payment should apply it once")
    void testRepeatedVerification_AppliedOnce() throws Exception {
        printTestHeader("Race: Repeated Verification");

        GroupEntity group = createGroup(2, 500, Frequency.DAILY, "2.00");
        List<UUID> members = fillGroup(group);
        cycleScheduler.advanceIfComplete(group.getId(), 1);
        ContributionEntity contribution = contributionFor(group.getId(), members.get(0), 2);
        PaymentRecord record = initiateContribution(group.getId(), members.get(0), contribution.getId());

        List<Callable<Object>> tasks = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            tasks.add(() -> settlementService.verifyAndSettle(record.getReference()));
        }
        List<SettlementResult> outcomes = asResults(runConcurrently(tasks));
        printOutput("Statuses", outcomes.stream().map(SettlementResult::getStatus).toList());

        assertEquals(1, outcomes.stream()
            .filter(r -> r.getStatus() == SettlementResult.Status.CONTRIBUTION_PAID).count());
        assertEquals(4, outcomes.stream()
            .filter(r -> r.getStatus() == SettlementResult.Status.ALREADY_PROCESSED).count());

        printSuccess("Applied once, four replays");
    }

    private ContributionEntity contributionFor(UUID groupId, UUID userId, int cycle) {
        return contributionRepository.findByGroupIdAndUserIdOrderByCycleNumberAsc(groupId, userId).stream()
            .filter(c -> c.getCycleNumber() == cycle)
            .findFirst()
            .orElseThrow(() -> new AssertionError("No cycle " + cycle + " contribution for " + userId));
    }

    private List<SettlementResult> asResults(List<Object> outcomes) {
        return outcomes.stream().map(SettlementResult.class::cast).toList();
    }

    /**
     * Starts every task at the same moment and waits for all of them.
     */
    private List<Object> runConcurrently(List<Callable<Object>> tasks) throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(tasks.size());
        CountDownLatch ready = new CountDownLatch(tasks.size());
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Object>> futures = new ArrayList<>();
            for (Callable<Object> task : tasks) {
                futures.add(executor.submit(() -> {
                    ready.countDown();
                    start.await();
                    return task.call();
                }));
            }
            assertTrue(ready.await(10, TimeUnit.SECONDS));
            start.countDown();

            List<Object> results = new ArrayList<>();
            for (Future<Object> future : futures) {
                results.add(future.get(30, TimeUnit.SECONDS));
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }
}
