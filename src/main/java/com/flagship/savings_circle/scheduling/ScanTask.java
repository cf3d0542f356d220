package com.flagship.savings_circle.scheduling;

/**
 * Passes of the scheduled scan, run in declaration order.
 */
public enum ScanTask {
    /** Mark late contributions OVERDUE and apply late penalties. */
    OVERDUE,
    /** Close settled cycles, pay them out and open the next one. */
    CYCLES,
    /** Re-verify stale pending payments and re-apply verified but unprocessed ones. */
    RECONCILE
}
