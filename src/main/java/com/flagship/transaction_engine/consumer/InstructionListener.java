package com.flagship.transaction_engine.consumer;

import com.flagship.transaction_engine.observability.CorrelationContext;
import com.flagship.transaction_engine.queue.Delivery;
import com.flagship.transaction_engine.queue.KafkaDeliveryHandle;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.header.Header;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.listener.ConsumerSeekAware;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collection;

/**
 * Kafka consumer for the instruction queue.
 *
 * Uses manual acknowledgment: the offset is only committed once the
 * {@link TransactionProcessor} resolved the record. Attempt counts for revoked
 * partitions are dropped, the new owner starts its own count.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class InstructionListener implements ConsumerSeekAware {

    private final TransactionProcessor processor;
    private final DeliveryAttemptTracker attemptTracker;
    private final Duration redeliveryBackoff;

    public InstructionListener(TransactionProcessor processor,
                               DeliveryAttemptTracker attemptTracker,
                               @Value("${queue.redelivery-backoff-ms:1000}") long redeliveryBackoffMs) {
        this.processor = processor;
        this.attemptTracker = attemptTracker;
        this.redeliveryBackoff = Duration.ofMillis(redeliveryBackoffMs);
    }

    @KafkaListener(
        topics = "${queue.topic:transactions}",
        groupId = "${spring.kafka.consumer.group-id:transaction-processors}",
        concurrency = "${consumer.concurrency:3}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received message: topic={}, partition={}, offset={}, key={}",
                record.topic(), record.partition(), record.offset(), record.key());

        Delivery delivery = new Delivery(
            record.value(),
            record.key(),
            record.topic(),
            record.partition(),
            record.offset(),
            correlationId(record),
            new KafkaDeliveryHandle(ack, redeliveryBackoff)
        );

        ProcessingOutcome outcome = processor.process(delivery);
        if (outcome.acknowledged()) {
            log.debug("Resolved delivery {}: {}", outcome.deliveryId(), outcome.disposition());
        } else {
            log.debug("Delivery {} returned for redelivery in {} ms: {}",
                    outcome.deliveryId(), redeliveryBackoff.toMillis(), outcome.reason());
        }
    }

    @Override
    public void onPartitionsRevoked(Collection<TopicPartition> partitions) {
        for (TopicPartition partition : partitions) {
            int cleared = attemptTracker.clearPartition(partition.topic(), partition.partition());
            if (cleared > 0) {
                log.info("Partition {} revoked, dropped attempt counts for {} delivery(ies)", partition, cleared);
            }
        }
    }

    private static String correlationId(ConsumerRecord<String, String> record) {
        Header header = record.headers().lastHeader(CorrelationContext.CORRELATION_ID_HEADER);
        return header == null || header.value() == null
                ? null
                : new String(header.value(), StandardCharsets.UTF_8);
    }
}
