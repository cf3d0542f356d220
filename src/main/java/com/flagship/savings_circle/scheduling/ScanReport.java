package com.flagship.savings_circle.scheduling;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.Set;

@Value
@Builder
public class ScanReport {

    @JsonProperty("as_of")
    LocalDate asOf;

    @JsonProperty("tasks")
    Set<ScanTask> tasks;

    @JsonProperty("groups_scanned")
    int groupsScanned;

    @JsonProperty("contributions_marked_overdue")
    int contributionsMarkedOverdue;

    @JsonProperty("penalties_applied")
    int penaltiesApplied;

    @JsonProperty("cycles_completed")
    int cyclesCompleted;

    @JsonProperty("payments_reconciled")
    int paymentsReconciled;

    @JsonProperty("payments_settled")
    int paymentsSettled;

    @JsonProperty("failures")
    int failures;
}
