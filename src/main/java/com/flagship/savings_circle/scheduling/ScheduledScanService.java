package com.flagship.savings_circle.scheduling;

import com.flagship.savings_circle.config.SettlementProperties;
import com.flagship.savings_circle.cycle.CycleScheduler;
import com.flagship.savings_circle.group.GroupEntity;
import com.flagship.savings_circle.group.GroupRepository;
import com.flagship.savings_circle.group.GroupStatus;
import com.flagship.savings_circle.observability.CorrelationContext;
import com.flagship.savings_circle.payment.PaymentLedger;
import com.flagship.savings_circle.payment.PaymentRecord;
import com.flagship.savings_circle.payment.PaymentSettlementService;
import com.flagship.savings_circle.payment.SettlementResult;
import com.flagship.savings_circle.penalty.OverdueScanResult;
import com.flagship.savings_circle.penalty.PenaltyEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Periodic maintenance: overdue marking, cycle advancement and payment reconciliation.
 *
 * Every group and every payment is handled in its own transaction. One
 * failure is logged and counted and the scan moves on; rerunning the scan is
 * always safe because each step is a conditional update.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScheduledScanService {

    private final GroupRepository groupRepository;
    private final PenaltyEngine penaltyEngine;
    private final CycleScheduler cycleScheduler;
    private final PaymentLedger paymentLedger;
    private final PaymentSettlementService settlementService;
    private final SettlementProperties settlementProperties;
    private final Clock clock;

    public ScanReport runAll() {
        return run(null, null);
    }

    /**
     * @param asOf  date contributions are compared against; null means today
     * @param tasks passes to run; null or empty means all
     */
    public ScanReport run(LocalDate asOf, Collection<ScanTask> tasks) {
        LocalDate effectiveDate = asOf != null ? asOf : LocalDate.now(clock);
        Set<ScanTask> effectiveTasks = tasks == null || tasks.isEmpty()
            ? EnumSet.allOf(ScanTask.class)
            : EnumSet.copyOf(tasks);

        log.info("Scheduled scan started: asOf={}, tasks={}", effectiveDate, effectiveTasks);
        long startTime = System.currentTimeMillis();

        ScanReport.ScanReportBuilder report = ScanReport.builder().asOf(effectiveDate).tasks(effectiveTasks);
        int failures = 0;

        List<GroupEntity> activeGroups = groupRepository.findByStatus(GroupStatus.ACTIVE);
        report.groupsScanned(activeGroups.size());

        if (effectiveTasks.contains(ScanTask.OVERDUE)) {
            int marked = 0;
            int penalties = 0;
            for (GroupEntity group : activeGroups) {
                try {
                    OverdueScanResult result = penaltyEngine.scanOverdue(group.getId(), effectiveDate);
                    marked += result.getMarkedOverdue();
                    penalties += result.getPenaltiesApplied();
                } catch (Exception e) {
                    failures++;
                    log.error("Overdue scan failed for group {}", group.getId(), e);
                }
            }
            report.contributionsMarkedOverdue(marked).penaltiesApplied(penalties);
        }

        if (effectiveTasks.contains(ScanTask.CYCLES)) {
            int completed = 0;
            for (GroupEntity group : activeGroups) {
                try {
                    if (advanceGroup(group)) {
                        completed++;
                    }
                } catch (Exception e) {
                    failures++;
                    log.error("Cycle advance failed for group {}", group.getId(), e);
                }
            }
            report.cyclesCompleted(completed);
        }

        if (effectiveTasks.contains(ScanTask.RECONCILE)) {
            int reconciled = 0;
            int settled = 0;
            List<PaymentRecord> candidates = paymentLedger.findReconcilable(
                clock.instant().minus(settlementProperties.getReconcileAfter()),
                settlementProperties.getReconcileBatchSize());
            for (PaymentRecord record : candidates) {
                try {
                    SettlementResult result = settlementService.verifyAndSettle(record.getReference());
                    reconciled++;
                    if (result.getStatus() == SettlementResult.Status.MEMBERSHIP_ACTIVATED
                            || result.getStatus() == SettlementResult.Status.CONTRIBUTION_PAID) {
                        settled++;
                    }
                } catch (Exception e) {
                    failures++;
                    log.error("Reconciliation failed for payment {}", record.getReference(), e);
                }
            }
            report.paymentsReconciled(reconciled).paymentsSettled(settled);
        }

        ScanReport result = report.failures(failures).build();
        log.info("Scheduled scan finished in {}ms: {}", System.currentTimeMillis() - startTime, result);
        return result;
    }

    private boolean advanceGroup(GroupEntity group) {
        CorrelationContext.putGroupId(group.getId());
        try {
            return cycleScheduler.findActiveCycle(group.getId())
                .map(cycle -> cycleScheduler.advanceIfComplete(group.getId(), cycle.getCycleNumber()))
                .orElse(false);
        } finally {
            CorrelationContext.clearPaymentContext();
        }
    }
}
