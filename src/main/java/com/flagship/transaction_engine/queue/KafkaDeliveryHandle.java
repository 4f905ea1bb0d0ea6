package com.flagship.transaction_engine.queue;

import lombok.RequiredArgsConstructor;
import org.springframework.kafka.support.Acknowledgment;

import java.time.Duration;

/**
 * Delivery handle over a manually acknowledged Kafka record.
 *
 * Rejecting with requeue rewinds the partition to this record, so it and every
 * later record of the partition are redelivered after the backoff. Kafka has no
 * per-record drop, so rejecting without requeue commits the offset.
 *
 * Must be resolved on the listener thread.
 */
@RequiredArgsConstructor
public class KafkaDeliveryHandle implements DeliveryHandle {

    private final Acknowledgment acknowledgment;
    private final Duration redeliveryBackoff;

    @Override
    public void ack() {
        acknowledgment.acknowledge();
    }

    @Override
    public void reject(boolean requeue) {
        if (requeue) {
            acknowledgment.nack(redeliveryBackoff);
        } else {
            acknowledgment.acknowledge();
        }
    }
}
