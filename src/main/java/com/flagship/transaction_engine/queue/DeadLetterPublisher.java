package com.flagship.transaction_engine.queue;

import com.flagship.transaction_engine.observability.CorrelationContext;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.Headers;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Moves poison deliveries to the dead-letter topic.
 *
 * The raw payload is kept byte-for-byte; the reason and origin travel as headers.
 * A delivery may only be dropped from the main queue after this publish succeeded.
 */
@Component
@Slf4j
public class DeadLetterPublisher {

    public static final String REASON_HEADER = "x-dead-letter-reason";
    public static final String ATTEMPTS_HEADER = "x-delivery-attempts";
    public static final String ORIGINAL_PARTITION_HEADER = "x-original-partition";
    public static final String ORIGINAL_OFFSET_HEADER = "x-original-offset";

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final String deadLetterTopic;
    private final long publishTimeoutMs;

    public DeadLetterPublisher(KafkaTemplate<String, String> kafkaTemplate,
                               @Value("${queue.dead-letter-topic:transactions.dlt}") String deadLetterTopic,
                               @Value("${queue.publish-timeout-ms:5000}") long publishTimeoutMs) {
        this.kafkaTemplate = kafkaTemplate;
        this.deadLetterTopic = deadLetterTopic;
        this.publishTimeoutMs = publishTimeoutMs;
    }

    /**
     * Publishes the delivery's payload to the dead-letter topic.
     *
     * @throws PublishException if the broker did not confirm the write
     */
    public void publish(Delivery delivery, String reason, int attempts) {
        ProducerRecord<String, String> record =
                new ProducerRecord<>(deadLetterTopic, delivery.key(), delivery.payload());
        Headers headers = record.headers();
        headers.add(REASON_HEADER, bytes(reason));
        headers.add(ATTEMPTS_HEADER, bytes(String.valueOf(attempts)));
        headers.add(ORIGINAL_PARTITION_HEADER, bytes(String.valueOf(delivery.partition())));
        headers.add(ORIGINAL_OFFSET_HEADER, bytes(String.valueOf(delivery.offset())));
        if (delivery.correlationId() != null) {
            headers.add(CorrelationContext.CORRELATION_ID_HEADER,
                    bytes(delivery.correlationId()));
        }

        try {
            kafkaTemplate.send(record).get(publishTimeoutMs, TimeUnit.MILLISECONDS);
            log.warn("Dead-lettered delivery {} after {} attempt(s): {}", delivery.id(), attempts, reason);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PublishException("Interrupted while dead-lettering " + delivery.id(), e);
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            throw new PublishException("Failed to dead-letter " + delivery.id(), e);
        }
    }

    private static byte[] bytes(String value) {
        return value == null ? new byte[0] : value.getBytes(StandardCharsets.UTF_8);
    }
}
