package com.flagship.savings_circle.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Snapshot of an outbox row handed to the publisher.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;
    UUID aggregateId;
    String eventType;
    String payload;
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;

    public boolean isPublished() {
        return publishedAt != null;
    }
}
