package com.flagship.savings_circle.payment;

/**
 * Normalized gateway verdict for a reference.
 */
public enum GatewayStatus {
    SUCCESS,
    FAILED,

    /**
     * The gateway knows the charge but it has not reached a final state yet.
     * Never written to the ledger.
     */
    IN_PROGRESS
}
