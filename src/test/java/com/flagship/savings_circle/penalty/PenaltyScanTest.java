package com.flagship.savings_circle.penalty;

import com.flagship.savings_circle.cycle.ContributionEntity;
import com.flagship.savings_circle.cycle.ContributionRepository;
import com.flagship.savings_circle.cycle.ContributionStatus;
import com.flagship.savings_circle.cycle.CycleScheduler;
import com.flagship.savings_circle.group.Frequency;
import com.flagship.savings_circle.group.GroupEntity;
import com.flagship.savings_circle.ledger.LedgerService;
import com.flagship.savings_circle.ledger.TransactionType;
import com.flagship.savings_circle.payment.PaymentRecord;
import com.flagship.savings_circle.payment.SettlementResult;
import com.flagship.savings_circle.scheduling.ScanReport;
import com.flagship.savings_circle.scheduling.ScanTask;
import com.flagship.savings_circle.scheduling.ScheduledScanService;
import com.flagship.savings_circle.support.AbstractIntegrationTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Overdue scan and late-payment penalty tests.
 *
 * The group starts on 2025-12-01 with MONTHLY contributions, so cycle 2 is due
 * on 2026-01-01 once cycle 1 has been paid out.
 */
class PenaltyScanTest extends AbstractIntegrationTest {

    private static final Instant GROUP_START = Instant.parse("2025-12-01T09:00:00Z");
    private static final LocalDate CYCLE_TWO_DUE = LocalDate.of(2026, 1, 1);

    @Autowired
    private ScheduledScanService scanService;

    @Autowired
    private CycleScheduler cycleScheduler;

    @Autowired
    private ContributionRepository contributionRepository;

    @Autowired
    private PenaltyRepository penaltyRepository;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private MockMvc mockMvc;

    private GroupEntity group;
    private List<UUID> members;

    @BeforeEach
    void setUpMonthlyGroup() {
        gatewayPaysInFull();
        clock.set(GROUP_START);
        group = createGroup(3, 1000, Frequency.MONTHLY, "10.00");
        members = fillGroup(group);
        assertTrue(cycleScheduler.advanceIfComplete(group.getId(), 1));
    }

    @Test
    @DisplayName("Scan should mark late contributions overdue and charge one penalty each")
    void testOverdueScan_AppliesPenalties() {
        printTestHeader("Overdue Scan: Penalties Applied");

        List<ContributionEntity> cycleTwo = cycleTwoContributions();
        assertTrue(cycleTwo.stream().allMatch(c -> c.getDueDate().equals(CYCLE_TWO_DUE)));

        LocalDate asOf = LocalDate.of(2026, 1, 3);
        printInput("As of", asOf);
        ScanReport report = scanService.run(asOf, EnumSet.of(ScanTask.OVERDUE));
        printOutput("Report", report);

        assertTrue(report.getContributionsMarkedOverdue() >= 3);
        assertTrue(report.getPenaltiesApplied() >= 3);
        assertTrue(cycleTwoContributions().stream().allMatch(c -> c.getStatus() == ContributionStatus.OVERDUE));

        List<PenaltyEntity> penalties = penaltyRepository.findByGroupIdOrderByCreatedAtAsc(group.getId());
        assertEquals(3, penalties.size());
        for (PenaltyEntity penalty : penalties) {
            assertEquals(50, penalty.getAmount());
            assertEquals(PenaltyType.LATE_PAYMENT, penalty.getType());
            assertEquals(PenaltyStatus.APPLIED, penalty.getStatus());
            assertEquals("Late payment - 2 days overdue", penalty.getReason());
        }

        printSuccess("Three penalties of 50 applied");
    }

    @Test
    @DisplayName("Re-running the scan later should not add penalties")
    void testOverdueScan_Idempotent() {
        printTestHeader("Overdue Scan: Idempotent");

        scanService.run(LocalDate.of(2026, 1, 3), EnumSet.of(ScanTask.OVERDUE));
        scanService.run(LocalDate.of(2026, 1, 5), EnumSet.of(ScanTask.OVERDUE));

        List<PenaltyEntity> penalties = penaltyRepository.findByGroupIdOrderByCreatedAtAsc(group.getId());
        printOutput("Penalties", penalties.size());
        assertEquals(3, penalties.size());
        assertTrue(penalties.stream().allMatch(p -> p.getReason().equals("Late payment - 2 days overdue")));

        printSuccess("Second scan added nothing");
    }

    @Test
    @DisplayName("Scan before the due date should leave contributions pending")
    void testOverdueScan_NotYetDue() {
        printTestHeader("Overdue Scan: Not Yet Due");

        scanService.run(CYCLE_TWO_DUE, EnumSet.of(ScanTask.OVERDUE));

        assertTrue(cycleTwoContributions().stream().allMatch(c -> c.getStatus() == ContributionStatus.PENDING));
        assertTrue(penaltyRepository.findByGroupIdOrderByCreatedAtAsc(group.getId()).isEmpty());

        printSuccess("Nothing overdue on the due date itself");
    }

    @Test
    @DisplayName("Paying an overdue contribution should collect the penalty with it")
    void testOverduePayment_IncludesPenalty() {
        printTestHeader("Overdue Payment With Penalty");

        scanService.run(LocalDate.of(2026, 1, 3), EnumSet.of(ScanTask.OVERDUE));
        ContributionEntity overdue = contributionFor(members.get(0));

        PaymentRecord record = initiateContribution(group.getId(), members.get(0), overdue.getId());
        printOutput("Expected amount", record.getExpectedAmount());
        assertEquals(1050, record.getExpectedAmount());

        SettlementResult result = settlementService.verifyAndSettle(record.getReference());
        assertEquals(SettlementResult.Status.CONTRIBUTION_PAID, result.getStatus());

        assertEquals(ContributionStatus.PAID, contributionFor(members.get(0)).getStatus());
        PenaltyEntity penalty = penaltyRepository.findByContributionId(overdue.getId()).orElseThrow();
        assertEquals(PenaltyStatus.PAID, penalty.getStatus());
        assertNotNull(penalty.getResolvedAt());
        assertEquals(1, ledgerService.getTransactionsForGroup(group.getId()).stream()
            .filter(t -> t.getType() == TransactionType.PENALTY && t.getAmount() == 50)
            .count());

        printSuccess("Contribution and penalty paid in one charge");
    }

    @Test
    @DisplayName("Waiving an overdue contribution should waive its penalty too")
    void testWaiveEndpoint_WaivesPenalty() throws Exception {
        printTestHeader("Waive Endpoint");

        scanService.run(LocalDate.of(2026, 1, 3), EnumSet.of(ScanTask.OVERDUE));
        ContributionEntity overdue = contributionFor(members.get(1));

        mockMvc.perform(post("/internal/contributions/{id}/waive", overdue.getId()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("WAIVED"))
            .andExpect(jsonPath("$.cycle_number").value(2));

        assertEquals(PenaltyStatus.WAIVED,
            penaltyRepository.findByContributionId(overdue.getId()).orElseThrow().getStatus());

        // A paid contribution cannot be waived
        ContributionEntity paidAtEntry = contributionRepository
            .findByGroupIdAndUserIdOrderByCycleNumberAsc(group.getId(), members.get(1)).get(0);
        mockMvc.perform(post("/internal/contributions/{id}/waive", paidAtEntry.getId()))
            .andExpect(status().isConflict());

        printSuccess("Contribution and penalty waived");
    }

    @Test
    @DisplayName("Scan endpoint should accept an explicit date and task list")
    void testScanEndpoint() throws Exception {
        printTestHeader("Scan Endpoint");

        mockMvc.perform(post("/internal/scheduled-scan")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"as_of\":\"2026-01-03\",\"tasks\":[\"OVERDUE\"]}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.as_of").value("2026-01-03"))
            .andExpect(jsonPath("$.tasks[0]").value("OVERDUE"))
            .andExpect(jsonPath("$.failures").value(0));

        assertEquals(3, penaltyRepository.findByGroupIdOrderByCreatedAtAsc(group.getId()).size());

        printSuccess("Scan triggered over HTTP");
    }

    @Test
    @DisplayName("Paused groups should be skipped by the overdue scan")
    void testOverdueScan_SkipsPausedGroup() {
        printTestHeader("Overdue Scan: Paused Group");

        groupService.pause(group.getId());
        scanService.run(LocalDate.of(2026, 1, 3), EnumSet.of(ScanTask.OVERDUE));

        assertTrue(cycleTwoContributions().stream().allMatch(c -> c.getStatus() == ContributionStatus.PENDING));
        assertTrue(penaltyRepository.findByGroupIdOrderByCreatedAtAsc(group.getId()).isEmpty());

        printSuccess("Paused group untouched");
    }

    private List<ContributionEntity> cycleTwoContributions() {
        return contributionRepository.findByGroupIdAndCycleNumberOrderByCreatedAtAsc(group.getId(), 2);
    }

    private ContributionEntity contributionFor(UUID userId) {
        return contributionRepository.findByGroupIdAndUserIdOrderByCycleNumberAsc(group.getId(), userId).stream()
            .filter(c -> c.getCycleNumber() == 2)
            .findFirst()
            .orElseThrow();
    }
}
