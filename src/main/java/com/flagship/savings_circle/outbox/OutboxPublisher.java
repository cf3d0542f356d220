package com.flagship.savings_circle.outbox;

import com.flagship.savings_circle.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Drains the outbox to Kafka.
 *
 * Sends are synchronous and keyed by group id so a group's events land on one
 * partition in commit order. Rows that fail {@code max-retries} times stay in
 * the table as dead letters and are no longer claimed.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.events:savings-circle.events}")
    private String eventsTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        try {
            List<OutboxEvent> batch = outboxService.claimBatch(maxRetries, batchSize);
            if (batch.isEmpty()) {
                return;
            }
            log.debug("Publishing {} outbox events", batch.size());
            for (OutboxEvent event : batch) {
                publish(event);
            }
        } catch (Exception e) {
            log.error("Outbox polling loop failed", e);
        }
    }

    private void publish(OutboxEvent event) {
        try {
            SendResult<String, String> result = kafkaTemplate
                .send(eventsTopic, event.getAggregateId().toString(), event.getPayload())
                .get();

            log.debug("Published {} for group {} to {}-{}@{}",
                event.getEventType(), event.getAggregateId(),
                result.getRecordMetadata().topic(),
                result.getRecordMetadata().partition(),
                result.getRecordMetadata().offset());

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outboxService.markFailed(event.getId(), "interrupted");
            outboxMetrics.recordEventPublishFailed(event.getEventType());
        } catch (Exception e) {
            log.error("Failed to publish outbox event {} ({}): {}", event.getId(), event.getEventType(), e.getMessage());
            outboxService.markFailed(event.getId(), e.getMessage());
            outboxMetrics.recordEventPublishFailed(event.getEventType());
            if (event.getRetryCount() + 1 >= maxRetries) {
                log.warn("Outbox event {} reached {} attempts and is now dead-lettered", event.getId(), maxRetries);
                outboxMetrics.recordEventDeadLettered(event.getEventType());
            }
        }
    }

    public void triggerPublish() {
        publishPendingEvents();
    }
}
