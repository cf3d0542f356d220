package com.flagship.savings_circle.ledger;

/**
 * Kind of money movement recorded in the transactions log.
 */
public enum TransactionType {
    SECURITY_DEPOSIT,
    CONTRIBUTION,
    PENALTY,
    PAYOUT,
    SERVICE_FEE
}
