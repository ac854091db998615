package com.flagship.lending_pool.observability;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Centralized metrics for lending operations.
 *
 * Metrics exposed:
 * - lending.operations: counter tagged with operation and outcome
 *   (success or the error code)
 * - lending.operation.latency: timer per operation
 * - lending.events.published / lending.events.publish.failure: notification delivery
 * - lending.pools: gauge of listed pools
 */
@Component
public class LendingMetrics {

    private final MeterRegistry registry;

    public LendingMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordOperation(String operation, String outcome) {
        registry.counter("lending.operations",
                "operation", sanitizeTag(operation),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("lending.operation.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordEventPublished(String eventType) {
        registry.counter("lending.events.published", "event_type", sanitizeTag(eventType)).increment();
    }

    public void recordEventPublishFailure(String eventType) {
        registry.counter("lending.events.publish.failure", "event_type", sanitizeTag(eventType)).increment();
    }

    public void registerPoolCountGauge(Supplier<Number> supplier) {
        Gauge.builder("lending.pools", supplier)
                .description("Number of listed pools")
                .strongReference(true)
                .register(registry);
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
