package com.flagship.savings_circle.consumer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.UUID;

/**
 * Runs a handler at most once per (event, consumer group).
 *
 * The handler's writes and the processed_events marker commit in one
 * transaction. A failing handler rolls both back and the exception reaches
 * the listener, so the message is redelivered and retried.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotentEventProcessor {

    private final ProcessedEventRepository repository;
    private final Clock clock;

    /**
     * @return true if the handler ran, false if the event was a duplicate
     */
    @Transactional
    public boolean processEvent(UUID eventId, String eventType, String aggregateType, UUID aggregateId,
                                String consumerGroup, Runnable handler) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            log.info("Event {} already processed by consumer group {}, skipping", eventId, consumerGroup);
            return false;
        }

        handler.run();

        repository.save(ProcessedEventEntity.fromDomain(ProcessedEvent.success(
            eventId, consumerGroup, eventType, aggregateType, aggregateId, clock.instant())));
        log.debug("Processed event {} by consumer group {}", eventId, consumerGroup);
        return true;
    }

    @Transactional
    public void skipEvent(UUID eventId, String eventType, String aggregateType, UUID aggregateId,
                          String consumerGroup, String reason) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            return;
        }
        repository.save(ProcessedEventEntity.fromDomain(ProcessedEvent.skipped(
            eventId, consumerGroup, eventType, aggregateType, aggregateId, clock.instant(), reason)));
        log.debug("Skipped event {} by consumer group {}: {}", eventId, consumerGroup, reason);
    }

    @Transactional(readOnly = true)
    public boolean isAlreadyProcessed(UUID eventId, String consumerGroup) {
        return repository.existsByEventIdAndConsumerGroup(eventId, consumerGroup);
    }
}
