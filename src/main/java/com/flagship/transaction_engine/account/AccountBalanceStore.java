package com.flagship.transaction_engine.account;

import com.flagship.transaction_engine.money.Money;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Row-level balance access for the balance mutator.
 *
 * Every method must run inside the caller's transaction: a lock taken by
 * {@link #lockBalance(String)} is held until that transaction ends.
 */
@Repository
@Transactional(propagation = Propagation.MANDATORY)
public class AccountBalanceStore {

    private final JdbcTemplate jdbcTemplate;

    public AccountBalanceStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Locks the account row and reads its balance.
     *
     * @return the balance, or empty if the account does not exist
     */
    public Optional<Money> lockBalance(String accountId) {
        List<BigDecimal> rows = jdbcTemplate.queryForList(
            "SELECT balance FROM accounts WHERE account_id = ? FOR UPDATE",
            BigDecimal.class,
            accountId
        );
        return rows.stream().findFirst().map(Money::of);
    }

    public void updateBalance(String accountId, Money balance) {
        int updated = jdbcTemplate.update(
            "UPDATE accounts SET balance = ? WHERE account_id = ?",
            balance.toBigDecimal(),
            accountId
        );
        if (updated != 1) {
            throw new IllegalStateException("Balance update affected " + updated + " rows for account " + accountId);
        }
    }

    /**
     * Bounds how long this transaction waits for a row lock. Scoped to the transaction.
     */
    public void applyLockTimeout(long timeoutMs) {
        // SET does not accept bind parameters
        jdbcTemplate.execute("SET LOCAL lock_timeout = '" + Math.max(0, timeoutMs) + "ms'");
    }
}
