package com.flagship.lending_pool.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.lending_pool.observability.LendingMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Publishes lending events to Kafka as JSON.
 *
 * Uses the pool id as key for partition affinity, so consumers see the
 * events of one pool in commit order. Sends are asynchronous; a failed send
 * is logged and counted, never propagated into the already committed operation.
 */
@Component
@ConditionalOnProperty(name = "events.kafka.enabled", havingValue = "true")
@Slf4j
public class KafkaLendingEventPublisher implements LendingEventPublisher {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final LendingMetrics metrics;
    private final String topic;

    public KafkaLendingEventPublisher(KafkaTemplate<String, String> kafkaTemplate,
                                      ObjectMapper objectMapper,
                                      LendingMetrics metrics,
                                      @Value("${kafka.topic.lending-events:lending-events}") String topic) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.topic = topic;
    }

    @Override
    public void publish(LendingEvent event) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize event: eventId={}, eventType={}", event.getEventId(), event.getEventType(), e);
            metrics.recordEventPublishFailure(event.getEventType());
            return;
        }

        String key = String.valueOf(event.getPoolId());
        kafkaTemplate.send(topic, key, payload).whenComplete((result, error) -> {
            if (error != null) {
                log.error("Failed to publish event: eventId={}, eventType={}, error={}",
                        event.getEventId(), event.getEventType(), error.getMessage());
                metrics.recordEventPublishFailure(event.getEventType());
            } else {
                log.debug("Published event: eventId={}, topic={}, partition={}, offset={}",
                        event.getEventId(),
                        result.getRecordMetadata().topic(),
                        result.getRecordMetadata().partition(),
                        result.getRecordMetadata().offset());
                metrics.recordEventPublished(event.getEventType());
            }
        });
    }
}
