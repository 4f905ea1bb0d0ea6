package com.flagship.transaction_engine.transaction.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.transaction_engine.instruction.Instruction;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Response for a queued transaction. Acceptance only means the instruction is on
 * the queue; it is applied asynchronously.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TransactionAcceptedResponse {

    public static final String QUEUED_MESSAGE = "Transaction queued successfully";

    @JsonProperty("message")
    String message;

    @JsonProperty("type")
    String type;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("instruction_id")
    UUID instructionId;

    public static TransactionAcceptedResponse from(Instruction instruction) {
        return TransactionAcceptedResponse.builder()
            .message(QUEUED_MESSAGE)
            .type(instruction.getKind().wireName())
            .amount(instruction.getAmount().toBigDecimal())
            .instructionId(instruction.getInstructionId())
            .build();
    }
}
