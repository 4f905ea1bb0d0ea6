package com.flagship.transaction_engine.ledger;

import com.flagship.transaction_engine.instruction.Instruction;
import com.flagship.transaction_engine.instruction.InstructionKind;
import com.flagship.transaction_engine.money.Money;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Immutable audit record of one committed instruction's effect on one account.
 *
 * A transfer yields two entries, one per side, each carrying that account's own
 * resulting balance. Entries are never updated or deleted.
 */
@Value
public class LedgerEntry {
    UUID id;
    String accountId;
    String fromAccountId;
    String toAccountId;
    InstructionKind kind;
    Money amount;
    Instant createdAt;
    Money currentBalance;
    UUID instructionId;

    /**
     * Creates the entry recording {@code instruction}'s effect on {@code accountId}.
     */
    public static LedgerEntry forAccount(Instruction instruction, String accountId,
                                         Money resultingBalance, Instant createdAt) {
        return new LedgerEntry(
            UUID.randomUUID(),
            accountId,
            instruction.getFromAccountId(),
            instruction.getToAccountId(),
            instruction.getKind(),
            instruction.getAmount(),
            createdAt,
            resultingBalance,
            instruction.getInstructionId()
        );
    }

    /**
     * Amount as it affected this entry's account: positive for deposits and
     * incoming transfers, negative for withdrawals and outgoing transfers.
     */
    public BigDecimal signedAmount() {
        BigDecimal value = amount.toBigDecimal();
        return switch (kind) {
            case DEPOSIT -> value;
            case WITHDRAWAL -> value.negate();
            case TRANSFER -> accountId.equals(fromAccountId) ? value.negate() : value;
        };
    }
}
