package com.flagship.savings_circle.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.savings_circle.event.ContributionPaidEvent;
import com.flagship.savings_circle.event.CycleCompletedEvent;
import com.flagship.savings_circle.event.GroupEvent;
import com.flagship.savings_circle.event.MembershipActivatedEvent;
import com.flagship.savings_circle.event.PayoutCreditedEvent;
import com.flagship.savings_circle.event.PenaltyAppliedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.function.Consumer;

/**
 * Kafka consumer for group events, feeding the notification store.
 *
 * Offsets are acknowledged only after the event is handled (or recognised as
 * a duplicate). A handler failure leaves the message unacknowledged for redelivery.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class SavingsCircleEventConsumer {

    static final String CONSUMER_GROUP = "notification-consumer";

    private final IdempotentEventProcessor eventProcessor;
    private final NotificationEventHandler eventHandler;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${kafka.topic.events:savings-circle.events}",
        groupId = "${spring.kafka.consumer.group-id:savings-circle-consumers}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received message: topic={}, partition={}, offset={}, key={}",
            record.topic(), record.partition(), record.offset(), record.key());

        EventEnvelope envelope = parseEnvelope(record.value());
        if (envelope == null) {
            log.warn("Unparseable event at offset {}, acknowledging to skip", record.offset());
            ack.acknowledge();
            return;
        }

        try {
            boolean processed = route(envelope, record.value());
            ack.acknowledge();
            if (processed) {
                log.info("Processed event: type={}, eventId={}, groupId={}",
                    envelope.eventType(), envelope.eventId(), envelope.groupId());
            }
        } catch (RuntimeException e) {
            log.error("Error processing event {} at offset {}: {}",
                envelope.eventId(), record.offset(), e.getMessage(), e);
            throw e;
        }
    }

    boolean route(EventEnvelope envelope, String rawPayload) {
        return switch (envelope.eventType()) {
            case MembershipActivatedEvent.EVENT_TYPE ->
                handle(envelope, rawPayload, MembershipActivatedEvent.class, eventHandler::onMembershipActivated);
            case ContributionPaidEvent.EVENT_TYPE ->
                handle(envelope, rawPayload, ContributionPaidEvent.class, eventHandler::onContributionPaid);
            case CycleCompletedEvent.EVENT_TYPE ->
                handle(envelope, rawPayload, CycleCompletedEvent.class, eventHandler::onCycleCompleted);
            case PayoutCreditedEvent.EVENT_TYPE ->
                handle(envelope, rawPayload, PayoutCreditedEvent.class, eventHandler::onPayoutCredited);
            case PenaltyAppliedEvent.EVENT_TYPE ->
                handle(envelope, rawPayload, PenaltyAppliedEvent.class, eventHandler::onPenaltyApplied);
            default -> {
                log.debug("No notification for event type {}, skipping", envelope.eventType());
                eventProcessor.skipEvent(envelope.eventId(), envelope.eventType(), GroupEvent.AGGREGATE_TYPE,
                    envelope.groupId(), CONSUMER_GROUP, "No handler for event type");
                yield false;
            }
        };
    }

    private <T extends GroupEvent> boolean handle(EventEnvelope envelope, String rawPayload,
                                                  Class<T> eventClass, Consumer<T> handler) {
        return eventProcessor.processEvent(
            envelope.eventId(), envelope.eventType(), GroupEvent.AGGREGATE_TYPE, envelope.groupId(),
            CONSUMER_GROUP,
            () -> handler.accept(deserialize(rawPayload, eventClass)));
    }

    EventEnvelope parseEnvelope(String json) {
        try {
            JsonNode node = objectMapper.readTree(json);
            if (node == null || !node.hasNonNull("eventId") || !node.hasNonNull("groupId")
                    || !node.hasNonNull("eventType")) {
                return null;
            }
            return new EventEnvelope(
                UUID.fromString(node.get("eventId").asText()),
                UUID.fromString(node.get("groupId").asText()),
                node.get("eventType").asText());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.error("Failed to parse event envelope: {}", e.getMessage());
            return null;
        }
    }

    private <T> T deserialize(String json, Class<T> eventClass) {
        try {
            return objectMapper.readValue(json, eventClass);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize " + eventClass.getSimpleName(), e);
        }
    }

    record EventEnvelope(UUID eventId, UUID groupId, String eventType) {}
}
