package com.flagship.transaction_engine.instruction;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.transaction_engine.money.Money;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Wire shape of a queued instruction.
 *
 * <pre>
 * { "account_id": string?, "from_account_id": string?, "to_account_id": string?,
 *   "type": "deposit"|"withdrawal"|"transfer", "amount": number, "instruction_id": uuid? }
 * </pre>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record InstructionPayload(
    @JsonProperty("account_id") String accountId,
    @JsonProperty("from_account_id") String fromAccountId,
    @JsonProperty("to_account_id") String toAccountId,
    @JsonProperty("type") String type,
    @JsonProperty("amount") BigDecimal amount,
    @JsonProperty("instruction_id") UUID instructionId
) {

    public static InstructionPayload from(Instruction instruction) {
        return new InstructionPayload(
            instruction.getAccountId(),
            instruction.getFromAccountId(),
            instruction.getToAccountId(),
            instruction.getKind().wireName(),
            instruction.getAmount().toBigDecimal(),
            instruction.getInstructionId()
        );
    }

    /**
     * Converts to a validated instruction.
     *
     * @throws InvalidInstructionException if the payload does not describe a valid instruction
     */
    public Instruction toInstruction() {
        if (type == null) {
            throw new InvalidInstructionException("transaction type is required");
        }
        if (amount == null) {
            throw new InvalidInstructionException("amount is required");
        }
        if (amount.signum() <= 0) {
            throw new InvalidInstructionException("amount must be greater than 0");
        }

        Money money;
        try {
            money = Money.of(amount);
        } catch (IllegalArgumentException | ArithmeticException e) {
            throw new InvalidInstructionException(e.getMessage(), e);
        }

        return Instruction.of(
            InstructionKind.fromWireName(type),
            accountId,
            fromAccountId,
            toAccountId,
            money,
            instructionId
        );
    }
}
