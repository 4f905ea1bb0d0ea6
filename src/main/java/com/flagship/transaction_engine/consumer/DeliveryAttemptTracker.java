package com.flagship.transaction_engine.consumer;

import com.flagship.transaction_engine.observability.TransactionMetrics;
import com.flagship.transaction_engine.queue.Delivery;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Counts failed attempts per delivery within this processor instance.
 *
 * Counts are keyed by topic, partition and offset, which stay fixed across
 * redeliveries of the same record. They reset when the delivery is resolved, when
 * its partition is revoked from this instance, or when the instance restarts, so a
 * rebalance or restart grants a poison message a fresh budget.
 */
@Component
public class DeliveryAttemptTracker {

    private final Map<String, Integer> failures = new ConcurrentHashMap<>();

    public DeliveryAttemptTracker(TransactionMetrics metrics) {
        metrics.registerRetryingDeliveriesGauge(failures::size);
    }

    /**
     * Records a failed attempt.
     *
     * @return failed attempts so far, including this one
     */
    public int recordFailure(Delivery delivery) {
        return failures.merge(delivery.id(), 1, Integer::sum);
    }

    /**
     * Number of the attempt currently running, starting at 1.
     */
    public int currentAttempt(Delivery delivery) {
        return failures.getOrDefault(delivery.id(), 0) + 1;
    }

    public void clear(Delivery delivery) {
        failures.remove(delivery.id());
    }

    /**
     * Forgets every count for records of one partition.
     *
     * @return number of deliveries forgotten
     */
    public int clearPartition(String topic, int partition) {
        String prefix = Delivery.partitionId(topic, partition) + "@";
        int before = failures.size();
        failures.keySet().removeIf(id -> id.startsWith(prefix));
        return before - failures.size();
    }

    public int inFlight() {
        return failures.size();
    }
}
