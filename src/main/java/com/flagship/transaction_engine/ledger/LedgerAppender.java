package com.flagship.transaction_engine.ledger;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;

/**
 * Appends ledger entries.
 *
 * Append is the only write: there is no update or delete path. Appends must join
 * the caller's transaction so that an entry commits or rolls back together with
 * the balance change it records.
 */
@Repository
public class LedgerAppender {

    private final JdbcTemplate jdbcTemplate;

    public LedgerAppender(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public LedgerEntry append(LedgerEntry entry) {
        jdbcTemplate.update(
            "INSERT INTO ledger_entries " +
            "(id, account_id, from_account_id, to_account_id, type, amount, created_at, current_balance, instruction_id) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)",
            entry.getId(),
            entry.getAccountId(),
            entry.getFromAccountId(),
            entry.getToAccountId(),
            entry.getKind().wireName(),
            entry.getAmount().toBigDecimal(),
            Timestamp.from(entry.getCreatedAt()),
            entry.getCurrentBalance().toBigDecimal(),
            entry.getInstructionId()
        );
        return entry;
    }
}
