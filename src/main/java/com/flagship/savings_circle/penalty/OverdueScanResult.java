package com.flagship.savings_circle.penalty;

import lombok.Value;

@Value
public class OverdueScanResult {
    int markedOverdue;
    int penaltiesApplied;
}
