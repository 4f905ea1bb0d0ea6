package com.flagship.transaction_engine.observability;

import com.flagship.transaction_engine.consumer.DeliveryAttemptTracker;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Custom health indicators for the transaction engine.
 */
public class HealthIndicators {

    /**
     * Health indicator for deliveries stuck in retry.
     * Degrades when many records keep failing, which usually means the store is down.
     */
    @Component("retryBacklogHealth")
    public static class RetryBacklogHealthIndicator implements HealthIndicator {

        static final int WARNING_THRESHOLD = 10;
        static final int CRITICAL_THRESHOLD = 100;

        private final DeliveryAttemptTracker attemptTracker;

        public RetryBacklogHealthIndicator(DeliveryAttemptTracker attemptTracker) {
            this.attemptTracker = attemptTracker;
        }

        @Override
        public Health health() {
            int retrying = attemptTracker.inFlight();

            Health.Builder builder = retrying < WARNING_THRESHOLD
                    ? Health.up()
                    : retrying < CRITICAL_THRESHOLD
                    ? Health.status("WARNING")
                    : Health.down();

            return builder
                    .withDetail("retryingDeliveries", retrying)
                    .withDetail("warningThreshold", WARNING_THRESHOLD)
                    .withDetail("criticalThreshold", CRITICAL_THRESHOLD)
                    .build();
        }
    }

    /**
     * Health indicator for Kafka connectivity.
     */
    @Component("kafkaHealth")
    public static class KafkaHealthIndicator implements HealthIndicator {

        private final KafkaTemplate<String, String> kafkaTemplate;

        public KafkaHealthIndicator(KafkaTemplate<String, String> kafkaTemplate) {
            this.kafkaTemplate = kafkaTemplate;
        }

        @Override
        public Health health() {
            try {
                var metrics = kafkaTemplate.metrics();
                if (metrics == null || metrics.isEmpty()) {
                    return Health.down()
                            .withDetail("error", "No Kafka connections established")
                            .build();
                }
                return Health.up()
                        .withDetail("metricsCount", metrics.size())
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }
}
