package com.flagship.transaction_engine.consumer;

import com.flagship.transaction_engine.consumer.ProcessingOutcome.Disposition;
import com.flagship.transaction_engine.instruction.Instruction;
import com.flagship.transaction_engine.instruction.InstructionCodec;
import com.flagship.transaction_engine.instruction.MalformedInstructionException;
import com.flagship.transaction_engine.observability.CorrelationContext;
import com.flagship.transaction_engine.observability.TransactionMetrics;
import com.flagship.transaction_engine.queue.DeadLetterPublisher;
import com.flagship.transaction_engine.queue.Delivery;
import com.flagship.transaction_engine.queue.PublishException;
import com.flagship.transaction_engine.transaction.AppliedOutcome;
import com.flagship.transaction_engine.transaction.BalanceMutator;
import com.flagship.transaction_engine.transaction.MutationException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Resolves each delivery from the instruction queue exactly once per attempt.
 *
 * Flow: decode, apply, then acknowledge according to the outcome:
 * - applied or duplicate: ack
 * - business failure (unknown account, insufficient balance): ack, the outcome is final
 * - malformed payload: dead-letter, then ack
 * - transient failure: requeue, until {@code processor.max-attempts} failures, then dead-letter
 * - dead-letter publish failure: requeue, the delivery is never dropped unrecorded
 *
 * A delivery is never acknowledged before its mutation committed or its
 * dead-letter copy was confirmed.
 */
@Service
@Slf4j
public class TransactionProcessor {

    static final String REASON_MALFORMED = "malformed_payload";
    static final String REASON_EXHAUSTED = "max_attempts_exceeded";

    private final InstructionCodec codec;
    private final BalanceMutator mutator;
    private final DeadLetterPublisher deadLetterPublisher;
    private final DeliveryAttemptTracker attemptTracker;
    private final TransactionMetrics metrics;
    private final int maxAttempts;

    public TransactionProcessor(InstructionCodec codec,
                                BalanceMutator mutator,
                                DeadLetterPublisher deadLetterPublisher,
                                DeliveryAttemptTracker attemptTracker,
                                TransactionMetrics metrics,
                                @Value("${processor.max-attempts:5}") int maxAttempts) {
        this.codec = codec;
        this.mutator = mutator;
        this.deadLetterPublisher = deadLetterPublisher;
        this.attemptTracker = attemptTracker;
        this.metrics = metrics;
        this.maxAttempts = Math.max(1, maxAttempts);
    }

    public ProcessingOutcome process(Delivery delivery) {
        CorrelationContext.setCorrelationId(delivery.correlationId());
        MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, CorrelationContext.getCorrelationId());
        try {
            return resolve(delivery);
        } finally {
            MDC.remove(CorrelationContext.INSTRUCTION_ID_MDC_KEY);
            MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
            CorrelationContext.clear();
        }
    }

    private ProcessingOutcome resolve(Delivery delivery) {
        log.debug("Processing delivery {}, attempt {}", delivery.id(), attemptTracker.currentAttempt(delivery));

        Instruction instruction;
        try {
            instruction = codec.decode(delivery.payload());
        } catch (MalformedInstructionException e) {
            log.error("Malformed instruction in delivery {}: {}", delivery.id(), e.getMessage());
            return deadLetter(delivery, null, REASON_MALFORMED + ": " + e.getMessage(),
                    REASON_MALFORMED, attemptTracker.currentAttempt(delivery));
        } catch (RuntimeException e) {
            // decoding is deterministic, a retry would fail the same way
            log.error("Could not decode delivery {}", delivery.id(), e);
            return deadLetter(delivery, null, REASON_MALFORMED + ": " + e,
                    REASON_MALFORMED, attemptTracker.currentAttempt(delivery));
        }

        String type = instruction.getKind().wireName();
        if (instruction.getInstructionId() != null) {
            MDC.put(CorrelationContext.INSTRUCTION_ID_MDC_KEY, instruction.getInstructionId().toString());
        }

        try {
            AppliedOutcome applied = mutator.apply(instruction);
            attemptTracker.clear(delivery);
            delivery.handle().ack();

            Disposition disposition = applied.isDuplicate() ? Disposition.DUPLICATE : Disposition.APPLIED;
            metrics.recordProcessed(type, disposition.name().toLowerCase());
            return ProcessingOutcome.of(delivery.id(), disposition);

        } catch (MutationException e) {
            if (e.isRetryable()) {
                return retryOrDeadLetter(delivery, type, e);
            }
            log.warn("Rejected instruction in delivery {}: type={}, reason={}, error={}",
                    delivery.id(), type, e.reason(), e.getMessage());
            attemptTracker.clear(delivery);
            delivery.handle().ack();
            metrics.recordProcessed(type, Disposition.REJECTED.name().toLowerCase());
            return ProcessingOutcome.failed(delivery.id(), Disposition.REJECTED, e.reason());

        } catch (RuntimeException e) {
            log.error("Unexpected failure applying delivery {}: type={}", delivery.id(), type, e);
            return retryOrDeadLetter(delivery, type, e);
        }
    }

    private ProcessingOutcome retryOrDeadLetter(Delivery delivery, String type, RuntimeException failure) {
        int attempts = attemptTracker.recordFailure(delivery);
        if (attempts >= maxAttempts) {
            log.error("Delivery {} failed {} time(s), giving up: {}", delivery.id(), attempts, failure.getMessage());
            return deadLetter(delivery, type, REASON_EXHAUSTED + ": " + failure.getMessage(),
                    REASON_EXHAUSTED, attempts);
        }

        log.warn("Requeueing delivery {} after attempt {}/{}: {}",
                delivery.id(), attempts, maxAttempts, failure.getMessage());
        delivery.handle().reject(true);
        metrics.recordProcessed(type, Disposition.REQUEUED.name().toLowerCase());
        return ProcessingOutcome.failed(delivery.id(), Disposition.REQUEUED, failure.getMessage());
    }

    private ProcessingOutcome deadLetter(Delivery delivery, String type, String reason,
                                         String reasonTag, int attempts) {
        try {
            deadLetterPublisher.publish(delivery, reason, attempts);
        } catch (PublishException e) {
            log.error("Could not dead-letter delivery {}, requeueing: {}", delivery.id(), e.getMessage());
            delivery.handle().reject(true);
            metrics.recordProcessed(type, Disposition.REQUEUED.name().toLowerCase());
            return ProcessingOutcome.failed(delivery.id(), Disposition.REQUEUED, e.getMessage());
        }

        attemptTracker.clear(delivery);
        delivery.handle().reject(false);
        metrics.recordDeadLettered(reasonTag);
        metrics.recordProcessed(type, Disposition.DEAD_LETTERED.name().toLowerCase());
        return ProcessingOutcome.failed(delivery.id(), Disposition.DEAD_LETTERED, reasonTag);
    }
}
