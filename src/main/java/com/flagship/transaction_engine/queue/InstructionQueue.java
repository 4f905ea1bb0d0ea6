package com.flagship.transaction_engine.queue;

import com.flagship.transaction_engine.instruction.Instruction;
import com.flagship.transaction_engine.instruction.InstructionCodec;
import com.flagship.transaction_engine.observability.CorrelationContext;
import com.flagship.transaction_engine.observability.TransactionMetrics;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Producer side of the instruction queue.
 *
 * Publishing:
 * 1. Encodes the instruction to its JSON wire payload
 * 2. Keys the record by the instruction's source account (per-account ordering)
 * 3. Attaches the current correlation id as a header
 * 4. Blocks until the broker confirms the write (acks=all, idempotent producer)
 *
 * A publish returns normally only after the broker accepted the record. Any failure,
 * including a timeout, raises {@link PublishException}.
 */
@Component
@Slf4j
public class InstructionQueue {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final InstructionCodec codec;
    private final TransactionMetrics metrics;
    private final String topic;
    private final long publishTimeoutMs;
    private final boolean assignInstructionIds;

    public InstructionQueue(KafkaTemplate<String, String> kafkaTemplate,
                            InstructionCodec codec,
                            TransactionMetrics metrics,
                            @Value("${queue.topic:transactions}") String topic,
                            @Value("${queue.publish-timeout-ms:5000}") long publishTimeoutMs,
                            @Value("${queue.assign-instruction-ids:false}") boolean assignInstructionIds) {
        this.kafkaTemplate = kafkaTemplate;
        this.codec = codec;
        this.metrics = metrics;
        this.topic = topic;
        this.publishTimeoutMs = publishTimeoutMs;
        this.assignInstructionIds = assignInstructionIds;
    }

    /**
     * Publishes an instruction durably.
     *
     * @return the instruction as published (with an assigned instruction id when
     *         {@code queue.assign-instruction-ids} is enabled)
     * @throws PublishException if the broker did not confirm the write
     */
    public Instruction publish(Instruction instruction) {
        Instruction outgoing = assignInstructionIds && instruction.getInstructionId() == null
                ? instruction.withInstructionId(UUID.randomUUID())
                : instruction;
        String type = outgoing.getKind().wireName();

        ProducerRecord<String, String> record =
                new ProducerRecord<>(topic, outgoing.partitionKey(), codec.encode(outgoing));
        record.headers().add(CorrelationContext.CORRELATION_ID_HEADER,
                CorrelationContext.getCorrelationId().getBytes(StandardCharsets.UTF_8));

        try {
            SendResult<String, String> result = kafkaTemplate.send(record)
                    .get(publishTimeoutMs, TimeUnit.MILLISECONDS);

            log.info("Published instruction: type={}, key={}, partition={}, offset={}",
                    type, record.key(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset());
            metrics.recordPublished(type, "success");
            return outgoing;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            metrics.recordPublished(type, "error");
            throw new PublishException("Interrupted while publishing instruction", e);
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            metrics.recordPublished(type, "error");
            log.error("Failed to publish instruction: type={}, key={}, error={}",
                    type, record.key(), e.getMessage());
            throw new PublishException("Failed to queue transaction", e);
        }
    }
}
