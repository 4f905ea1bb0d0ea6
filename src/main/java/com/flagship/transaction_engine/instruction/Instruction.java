package com.flagship.transaction_engine.instruction;

import com.flagship.transaction_engine.money.Money;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * A requested balance mutation, prior to application.
 *
 * Field presence depends on the kind:
 * - DEPOSIT / WITHDRAWAL carry {@code accountId}
 * - TRANSFER carries {@code fromAccountId} and {@code toAccountId}, which must differ
 *
 * The amount is always strictly positive. Instances are immutable and can only be
 * built through the factories, which enforce these rules.
 *
 * {@code instructionId} is optional. When present it is the idempotency key the
 * balance mutator records; when absent a redelivered instruction is applied again.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Instruction {
    InstructionKind kind;
    String accountId;
    String fromAccountId;
    String toAccountId;
    Money amount;
    UUID instructionId;

    public static Instruction deposit(String accountId, Money amount) {
        return of(InstructionKind.DEPOSIT, accountId, null, null, amount, null);
    }

    public static Instruction withdrawal(String accountId, Money amount) {
        return of(InstructionKind.WITHDRAWAL, accountId, null, null, amount, null);
    }

    public static Instruction transfer(String fromAccountId, String toAccountId, Money amount) {
        return of(InstructionKind.TRANSFER, null, fromAccountId, toAccountId, amount, null);
    }

    /**
     * Builds and validates an instruction.
     *
     * @throws InvalidInstructionException if the fields do not match the kind
     */
    public static Instruction of(InstructionKind kind, String accountId, String fromAccountId,
                                 String toAccountId, Money amount, UUID instructionId) {
        if (kind == null) {
            throw new InvalidInstructionException("transaction type is required");
        }
        if (amount == null || !amount.isPositive()) {
            throw new InvalidInstructionException("amount must be greater than 0");
        }

        return switch (kind) {
            case DEPOSIT, WITHDRAWAL -> {
                if (isBlank(accountId)) {
                    throw new InvalidInstructionException("account_id is required");
                }
                yield new Instruction(kind, accountId, null, null, amount, instructionId);
            }
            case TRANSFER -> {
                if (isBlank(fromAccountId)) {
                    throw new InvalidInstructionException("from_account_id is required");
                }
                if (isBlank(toAccountId)) {
                    throw new InvalidInstructionException("to_account_id is required");
                }
                if (fromAccountId.equals(toAccountId)) {
                    throw new InvalidInstructionException("from_account_id and to_account_id must differ");
                }
                yield new Instruction(kind, null, fromAccountId, toAccountId, amount, instructionId);
            }
        };
    }

    /**
     * Returns a copy carrying the given idempotency key.
     */
    public Instruction withInstructionId(UUID id) {
        return new Instruction(kind, accountId, fromAccountId, toAccountId, amount, id);
    }

    /**
     * Accounts this instruction touches, source first for transfers.
     */
    public List<String> affectedAccountIds() {
        return kind == InstructionKind.TRANSFER
            ? List.of(fromAccountId, toAccountId)
            : List.of(accountId);
    }

    /**
     * Account whose balance the instruction reduces, if any.
     */
    public String debitedAccountId() {
        return switch (kind) {
            case DEPOSIT -> null;
            case WITHDRAWAL -> accountId;
            case TRANSFER -> fromAccountId;
        };
    }

    /**
     * Key used to place the instruction on the queue. Instructions for the same
     * source account land on the same partition and keep their publish order.
     */
    public String partitionKey() {
        return kind == InstructionKind.TRANSFER ? fromAccountId : accountId;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
