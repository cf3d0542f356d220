package com.flagship.savings_circle.ledger;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * One money movement. The reference is unique, so posting the same movement twice is a no-op.
 */
@Value
public class LedgerTransaction {
    String reference;
    UUID userId;
    UUID groupId;
    TransactionType type;
    long amount;
    String description;
    Instant createdAt;

    public static LedgerTransaction of(String reference, UUID userId, UUID groupId,
                                       TransactionType type, long amount, String description) {
        return new LedgerTransaction(reference, userId, groupId, type, amount, description, null);
    }
}
