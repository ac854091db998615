package com.flagship.lending_pool.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topic for lending notifications. Only active when Kafka publishing is on.
 */
@Configuration
@ConditionalOnProperty(name = "events.kafka.enabled", havingValue = "true")
public class KafkaConfig {

    @Value("${kafka.topic.lending-events:lending-events}")
    private String lendingEventsTopic;

    /**
     * Partitioned by pool id, so events of one pool stay ordered.
     */
    @Bean
    public NewTopic lendingEventsTopic() {
        return TopicBuilder.name(lendingEventsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
