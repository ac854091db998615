package com.flagship.lending_pool.event;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.lending_pool.config.JacksonConfig;
import com.flagship.lending_pool.observability.LendingMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.math.BigInteger;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for the Kafka publisher against a mocked template.
 */
class KafkaLendingEventPublisherTest {

    private static final String TOPIC = "lending-events";

    private KafkaTemplate<String, String> kafkaTemplate;
    private SimpleMeterRegistry meterRegistry;
    private ObjectMapper objectMapper;
    private KafkaLendingEventPublisher publisher;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        kafkaTemplate = mock(KafkaTemplate.class);
        meterRegistry = new SimpleMeterRegistry();
        objectMapper = new JacksonConfig().objectMapper();
        publisher = new KafkaLendingEventPublisher(kafkaTemplate, objectMapper, new LendingMetrics(meterRegistry), TOPIC);
    }

    @Test
    @DisplayName("Event is sent as snake_case JSON keyed by pool id")
    void testPublishSuccess() throws Exception {
        DepositedEvent event = DepositedEvent.of(7L, "alice", new BigInteger("123456789012345678901234567890"),
            BigInteger.TEN, Instant.parse("2026-01-01T00:00:00Z"));
        ProducerRecord<String, String> record = new ProducerRecord<>(TOPIC, "7", "{}");
        RecordMetadata metadata = new RecordMetadata(new TopicPartition(TOPIC, 0), 42L, 0, 0L, 1, 2);
        when(kafkaTemplate.send(eq(TOPIC), eq("7"), anyString()))
            .thenReturn(CompletableFuture.completedFuture(new SendResult<>(record, metadata)));

        publisher.publish(event);

        ArgumentCaptor<String> payload = ArgumentCaptor.forClass(String.class);
        verify(kafkaTemplate).send(eq(TOPIC), eq("7"), payload.capture());
        JsonNode json = objectMapper.readTree(payload.getValue());
        assertEquals("alice", json.get("principal").asText());
        assertEquals(7L, json.get("pool_id").asLong());
        assertEquals("123456789012345678901234567890", json.get("amount").asText());
        assertEquals("Deposited", json.get("event_type").asText());
        assertEquals(1.0, meterRegistry.get("lending.events.published").counter().count());
    }

    @Test
    @DisplayName("A failed send is counted and not thrown")
    void testPublishFailure() {
        WithdrawnEvent event = WithdrawnEvent.of(3L, "bob", BigInteger.ONE, BigInteger.ONE, Instant.now());
        when(kafkaTemplate.send(eq(TOPIC), eq("3"), anyString()))
            .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        assertDoesNotThrow(() -> publisher.publish(event));

        assertEquals(1.0, meterRegistry.get("lending.events.publish.failure").counter().count());
        assertNull(meterRegistry.find("lending.events.published").counter());
    }
}
