package com.flagship.transaction_engine.queue;

/**
 * One message handed to a consumer, not yet resolved.
 *
 * @param payload       raw wire payload
 * @param key           record key (source account of the instruction)
 * @param topic         topic it was read from
 * @param partition     partition it was read from
 * @param offset        offset within the partition
 * @param correlationId correlation id carried by the publisher, may be null
 * @param handle        resolves the delivery
 */
public record Delivery(
    String payload,
    String key,
    String topic,
    int partition,
    long offset,
    String correlationId,
    DeliveryHandle handle
) {

    /**
     * Stable identity of this message across redeliveries.
     */
    public String id() {
        return partitionId(topic, partition) + "@" + offset;
    }

    public static String partitionId(String topic, int partition) {
        return topic + "-" + partition;
    }
}
