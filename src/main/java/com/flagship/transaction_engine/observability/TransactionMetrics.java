package com.flagship.transaction_engine.observability;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Centralized metrics for the transaction engine.
 *
 * Metrics exposed:
 * - instructions.published: instructions handed to the queue, by type and status
 * - instructions.processed: deliveries resolved by the processor, by type and disposition
 * - instructions.dead_lettered: deliveries moved to the dead-letter topic, by reason
 * - balance.mutation.latency: time spent inside the balance mutator, by type and result
 * - processor.retrying.deliveries: deliveries that failed and are awaiting redelivery
 */
@Component
public class TransactionMetrics {

    private final MeterRegistry registry;

    public TransactionMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordPublished(String type, String status) {
        registry.counter("instructions.published",
                "type", sanitizeTag(type),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordProcessed(String type, String disposition) {
        registry.counter("instructions.processed",
                "type", sanitizeTag(type),
                "disposition", sanitizeTag(disposition)
        ).increment();
    }

    public void recordDeadLettered(String reason) {
        registry.counter("instructions.dead_lettered",
                "reason", sanitizeTag(reason)
        ).increment();
    }

    public void recordMutationLatency(String type, String result, Duration duration) {
        registry.timer("balance.mutation.latency",
                "type", sanitizeTag(type),
                "result", sanitizeTag(result)
        ).record(duration);
    }

    /**
     * Registers a gauge for deliveries currently awaiting redelivery.
     */
    public void registerRetryingDeliveriesGauge(Supplier<Number> supplier) {
        Gauge.builder("processor.retrying.deliveries", supplier)
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
