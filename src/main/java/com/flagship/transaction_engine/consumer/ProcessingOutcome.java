package com.flagship.transaction_engine.consumer;

/**
 * How the processor resolved one delivery.
 *
 * @param deliveryId identity of the delivery
 * @param disposition what was done with it
 * @param reason failure reason for non-applied outcomes, null otherwise
 */
public record ProcessingOutcome(String deliveryId, Disposition disposition, String reason) {

    public enum Disposition {
        /** Applied and acknowledged. */
        APPLIED,
        /** Instruction id already recorded; acknowledged without changes. */
        DUPLICATE,
        /** Business failure; acknowledged since retrying cannot succeed. */
        REJECTED,
        /** Transient failure; returned to the queue for redelivery. */
        REQUEUED,
        /** Moved to the dead-letter topic, then acknowledged. */
        DEAD_LETTERED
    }

    public static ProcessingOutcome of(String deliveryId, Disposition disposition) {
        return new ProcessingOutcome(deliveryId, disposition, null);
    }

    public static ProcessingOutcome failed(String deliveryId, Disposition disposition, String reason) {
        return new ProcessingOutcome(deliveryId, disposition, reason);
    }

    public boolean acknowledged() {
        return disposition != Disposition.REQUEUED;
    }
}
