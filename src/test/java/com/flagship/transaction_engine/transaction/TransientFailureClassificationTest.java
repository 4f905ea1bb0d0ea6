package com.flagship.transaction_engine.transaction;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.UncategorizedSQLException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.TransactionSystemException;
import org.springframework.transaction.TransactionUsageException;

import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Which store failures the balance mutator reports as retryable.
 */
class TransientFailureClassificationTest {

    @Test
    @DisplayName("Lock, connection and commit failures are transient")
    void testTransientFailures() {
        assertTrue(BalanceMutator.isTransient(new CannotAcquireLockException("lock timeout")));
        assertTrue(BalanceMutator.isTransient(new DataAccessResourceFailureException("connection lost")));
        assertTrue(BalanceMutator.isTransient(new CannotCreateTransactionException("pool exhausted")));
        assertTrue(BalanceMutator.isTransient(new TransactionSystemException("commit failed")));
        assertTrue(BalanceMutator.isTransient(
            new UncategorizedSQLException("update", "UPDATE accounts", new SQLException("deadlock", "40P01"))));
    }

    @Test
    @DisplayName("Transaction misuse and constraint violations are not transient")
    void testNonTransientFailures() {
        assertFalse(BalanceMutator.isTransient(new IllegalTransactionStateException("no transaction")));
        assertFalse(BalanceMutator.isTransient(new TransactionUsageException("misconfigured")));
        assertFalse(BalanceMutator.isTransient(new DataIntegrityViolationException("check constraint")));
        assertFalse(BalanceMutator.isTransient(
            new UncategorizedSQLException("update", "UPDATE accounts", new SQLException("overflow", "22003"))));
    }
}
