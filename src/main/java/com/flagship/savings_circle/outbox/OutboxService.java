package com.flagship.savings_circle.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.savings_circle.event.GroupEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Writes group events into the outbox inside the caller's transaction.
 *
 * An event exists exactly when the state change that produced it commits.
 * Publishing to Kafka is left to {@link OutboxPublisher}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveEvent(GroupEvent event) {
        OutboxEventEntity entity = OutboxEventEntity.pending(
            GroupEvent.AGGREGATE_TYPE,
            event.getGroupId(),
            event.getEventType(),
            serializePayload(event),
            clock.instant());

        OutboxEventEntity saved = repository.save(entity);
        log.debug("Saved outbox event: type={}, groupId={}, eventId={}",
            event.getEventType(), event.getGroupId(), event.getEventId());
        return saved.toSnapshot();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> claimBatch(int maxRetries, int limit) {
        return repository.lockUnpublishedBatch(maxRetries, limit).stream()
            .map(OutboxEventEntity::toSnapshot)
            .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID outboxId) {
        repository.markPublished(outboxId, clock.instant());
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(UUID outboxId, String errorMessage) {
        repository.markFailed(outboxId, errorMessage);
        log.warn("Outbox event {} failed to publish: {}", outboxId, errorMessage);
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForGroup(UUID groupId) {
        return repository.findByAggregateIdOrderBySequenceNumberAsc(groupId).stream()
            .map(OutboxEventEntity::toSnapshot)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForGroup(UUID groupId, String eventType) {
        return repository.findByAggregateIdAndEventTypeOrderBySequenceNumberAsc(groupId, eventType).stream()
            .map(OutboxEventEntity::toSnapshot)
            .toList();
    }

    @Transactional(readOnly = true)
    public long countUnpublished() {
        return repository.countUnpublished();
    }

    private String serializePayload(GroupEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize " + event.getEventType() + " payload", e);
        }
    }
}
