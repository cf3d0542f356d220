package com.flagship.savings_circle.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Fact about a savings group, written to the outbox in the transaction that caused it.
 *
 * The group id is the aggregate id and the Kafka key, so a group's events stay ordered.
 */
public interface GroupEvent {

    String AGGREGATE_TYPE = "Group";

    /**
     * Unique per event instance; consumers de-duplicate on it.
     */
    UUID getEventId();

    UUID getGroupId();

    Instant getOccurredAt();

    String getEventType();
}
