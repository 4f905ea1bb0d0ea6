package com.flagship.transaction_engine.ledger;

import com.flagship.transaction_engine.transaction.AccountNotFoundException;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Read path over the ledger: per-account history and reconciliation.
 */
@Service
@RequiredArgsConstructor
public class LedgerQueryService {

    private final LedgerEntryRepository repository;
    private final JdbcTemplate jdbcTemplate;

    /**
     * Gets an account's ledger entries in commit order.
     */
    @Transactional(readOnly = true)
    public List<LedgerEntry> history(String accountId) {
        return repository.findByAccountIdOrderByCreatedAtAscSequenceNumberAsc(accountId)
            .stream()
            .map(LedgerEntryEntity::toDomain)
            .toList();
    }

    /**
     * Checks the account's stored balance against opening balance plus the signed
     * sum of its ledger entries. Both are read in one snapshot.
     *
     * @throws AccountNotFoundException if the account does not exist
     */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public Reconciliation reconcile(String accountId) {
        Map<String, Object> account;
        try {
            account = jdbcTemplate.queryForMap(
                "SELECT balance, opening_balance FROM accounts WHERE account_id = ?",
                accountId
            );
        } catch (EmptyResultDataAccessException e) {
            throw new AccountNotFoundException(accountId);
        }

        // Deposits and incoming transfers add, withdrawals and outgoing transfers subtract
        BigDecimal ledgerNet = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(CASE " +
            "  WHEN type = 'deposit' THEN amount " +
            "  WHEN type = 'withdrawal' THEN -amount " +
            "  WHEN type = 'transfer' AND from_account_id = account_id THEN -amount " +
            "  WHEN type = 'transfer' AND to_account_id = account_id THEN amount " +
            "  ELSE 0 END), 0) " +
            "FROM ledger_entries WHERE account_id = ?",
            BigDecimal.class,
            accountId
        );
        if (ledgerNet == null) {
            ledgerNet = BigDecimal.ZERO;
        }

        BigDecimal opening = (BigDecimal) account.get("opening_balance");
        BigDecimal actual = (BigDecimal) account.get("balance");

        return new Reconciliation(
            accountId,
            opening,
            ledgerNet,
            opening.add(ledgerNet),
            actual,
            repository.countByAccountId(accountId)
        );
    }
}
