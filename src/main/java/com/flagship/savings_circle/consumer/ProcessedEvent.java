package com.flagship.savings_circle.consumer;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Marker that one consumer group has handled one event.
 *
 * The same event id may appear once per consumer group, so independent
 * consumers replay and de-duplicate independently.
 */
@Value
public class ProcessedEvent {
    UUID eventId;
    String consumerGroup;
    String eventType;
    String aggregateType;
    UUID aggregateId;
    Instant processedAt;
    ProcessingResult result;
    String note;

    public enum ProcessingResult {
        SUCCESS,
        /** Not relevant to this consumer; recorded so it is not looked at again. */
        SKIPPED
    }

    public static ProcessedEvent success(UUID eventId, String consumerGroup, String eventType,
                                         String aggregateType, UUID aggregateId, Instant processedAt) {
        return new ProcessedEvent(eventId, consumerGroup, eventType, aggregateType, aggregateId,
            processedAt, ProcessingResult.SUCCESS, null);
    }

    public static ProcessedEvent skipped(UUID eventId, String consumerGroup, String eventType,
                                         String aggregateType, UUID aggregateId, Instant processedAt,
                                         String reason) {
        return new ProcessedEvent(eventId, consumerGroup, eventType, aggregateType, aggregateId,
            processedAt, ProcessingResult.SKIPPED, reason);
    }
}
