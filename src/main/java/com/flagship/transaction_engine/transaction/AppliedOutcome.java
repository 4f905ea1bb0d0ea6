package com.flagship.transaction_engine.transaction;

import com.flagship.transaction_engine.instruction.Instruction;
import com.flagship.transaction_engine.ledger.LedgerEntry;
import lombok.Value;

import java.util.List;

/**
 * Result of a committed balance mutation.
 *
 * A duplicate outcome means the instruction id was already recorded and nothing
 * changed; its entry list is empty.
 */
@Value
public class AppliedOutcome {
    Instruction instruction;
    List<LedgerEntry> entries;
    boolean duplicate;

    public static AppliedOutcome applied(Instruction instruction, List<LedgerEntry> entries) {
        return new AppliedOutcome(instruction, List.copyOf(entries), false);
    }

    public static AppliedOutcome duplicate(Instruction instruction) {
        return new AppliedOutcome(instruction, List.of(), true);
    }
}
