package com.flagship.transaction_engine.instruction;

import java.util.Arrays;

/**
 * Kind of balance mutation an instruction requests.
 * The wire name is what travels on the queue and is stored in the ledger.
 */
public enum InstructionKind {
    DEPOSIT("deposit"),
    WITHDRAWAL("withdrawal"),
    TRANSFER("transfer");

    private final String wireName;

    InstructionKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Resolves a wire name.
     *
     * @throws InvalidInstructionException if the name is unknown
     */
    public static InstructionKind fromWireName(String name) {
        return Arrays.stream(values())
            .filter(kind -> kind.wireName.equals(name))
            .findFirst()
            .orElseThrow(() -> new InvalidInstructionException("invalid transaction type: " + name));
    }
}
