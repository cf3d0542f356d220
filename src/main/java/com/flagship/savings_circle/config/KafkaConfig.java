package com.flagship.savings_circle.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Declares the topic that carries group lifecycle events published from the outbox.
 * Events are keyed by group id, so one group's events stay on one partition.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.events:savings-circle.events}")
    private String eventsTopic;

    @Bean
    public NewTopic savingsCircleEventsTopic() {
        return TopicBuilder.name(eventsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
