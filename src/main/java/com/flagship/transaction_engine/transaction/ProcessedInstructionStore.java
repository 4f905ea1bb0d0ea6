package com.flagship.transaction_engine.transaction;

import com.flagship.transaction_engine.instruction.Instruction;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Record of instruction ids that have been applied.
 *
 * The insert happens in the same transaction as the balance change, so a key is
 * recorded if and only if its instruction committed.
 */
@Repository
public class ProcessedInstructionStore {

    private final JdbcTemplate jdbcTemplate;

    public ProcessedInstructionStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Records the instruction's id.
     *
     * A concurrent transaction holding the same key blocks this insert until it
     * commits or rolls back.
     *
     * @return true if the key was new, false if it was already recorded
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean tryRecord(Instruction instruction) {
        int inserted = jdbcTemplate.update(
            "INSERT INTO processed_instructions (instruction_id, type, processed_at) " +
            "VALUES (?, ?, CURRENT_TIMESTAMP) ON CONFLICT (instruction_id) DO NOTHING",
            instruction.getInstructionId(),
            instruction.getKind().wireName()
        );
        return inserted == 1;
    }

    @Transactional(readOnly = true)
    public boolean isRecorded(UUID instructionId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM processed_instructions WHERE instruction_id = ?",
            Integer.class,
            instructionId
        );
        return count != null && count > 0;
    }
}
