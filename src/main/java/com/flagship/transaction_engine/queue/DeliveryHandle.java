package com.flagship.transaction_engine.queue;

/**
 * Resolves one queue delivery. Every delivery must eventually be resolved
 * exactly once, by either {@link #ack()} or {@link #reject(boolean)}.
 */
public interface DeliveryHandle {

    /**
     * Durably removes the delivery from the queue.
     */
    void ack();

    /**
     * Gives the delivery back.
     *
     * @param requeue {@code true} to have it redelivered, {@code false} to drop it
     *                (callers dead-letter the payload first)
     */
    void reject(boolean requeue);
}
