package com.flagship.transaction_engine.transaction;

import com.flagship.transaction_engine.account.AccountBalanceStore;
import com.flagship.transaction_engine.instruction.Instruction;
import com.flagship.transaction_engine.ledger.LedgerAppender;
import com.flagship.transaction_engine.ledger.LedgerEntry;
import com.flagship.transaction_engine.money.Money;
import com.flagship.transaction_engine.observability.CorrelationContext;
import com.flagship.transaction_engine.observability.TransactionMetrics;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.TransactionSystemException;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Applies one instruction to account balances and the ledger as a single unit.
 *
 * Inside one transaction:
 * 1. Bound lock waits with a transaction-local lock timeout
 * 2. Record the instruction id, if present (a known id makes the call a no-op)
 * 3. Lock every affected account row, in ascending account id order
 * 4. Check the debited account covers the amount
 * 5. Write the new balances
 * 6. Append one ledger entry per affected account
 * 7. Commit
 *
 * Any failure rolls back all of it. Business failures surface as
 * {@link AccountNotFoundException}, {@link InsufficientBalanceException} or
 * {@link BalanceLimitExceededException};
 * lock timeouts, deadlocks and lost connections as {@link StoreUnavailableException}.
 */
@Component
@Slf4j
public class BalanceMutator {

    // lock_not_available, deadlock_detected, serialization_failure
    private static final Set<String> TRANSIENT_SQL_STATES = Set.of("55P03", "40P01", "40001");

    private final TransactionTemplate transactionTemplate;
    private final AccountBalanceStore balanceStore;
    private final LedgerAppender ledgerAppender;
    private final ProcessedInstructionStore processedInstructions;
    private final TransactionMetrics metrics;
    private final long lockTimeoutMs;

    public BalanceMutator(PlatformTransactionManager transactionManager,
                          AccountBalanceStore balanceStore,
                          LedgerAppender ledgerAppender,
                          ProcessedInstructionStore processedInstructions,
                          TransactionMetrics metrics,
                          @Value("${mutator.lock-timeout-ms:5000}") long lockTimeoutMs) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.balanceStore = balanceStore;
        this.ledgerAppender = ledgerAppender;
        this.processedInstructions = processedInstructions;
        this.metrics = metrics;
        this.lockTimeoutMs = lockTimeoutMs;
    }

    /**
     * Applies the instruction atomically.
     *
     * @return the committed outcome
     * @throws MutationException if nothing was applied
     */
    public AppliedOutcome apply(Instruction instruction) {
        String type = instruction.getKind().wireName();
        long startNanos = System.nanoTime();
        String result = "error";

        MDC.put(CorrelationContext.ACCOUNT_ID_MDC_KEY, instruction.partitionKey());
        try {
            AppliedOutcome outcome = transactionTemplate.execute(status -> applyInTransaction(instruction));
            result = outcome.isDuplicate() ? "duplicate" : "applied";

            if (outcome.isDuplicate()) {
                log.info("Instruction already applied, skipping: type={}, instructionId={}",
                        type, instruction.getInstructionId());
            } else {
                log.info("Applied instruction: type={}, amount={}, entries={}",
                        type, instruction.getAmount(), outcome.getEntries().size());
            }
            return outcome;

        } catch (MutationException e) {
            result = e.reason();
            throw e;
        } catch (DataAccessException | TransactionException e) {
            if (isTransient(e)) {
                StoreUnavailableException unavailable =
                        new StoreUnavailableException("Store unavailable: " + e.getMessage(), e);
                result = unavailable.reason();
                log.warn("Transient store failure applying instruction: type={}, error={}", type, e.getMessage());
                throw unavailable;
            }
            throw e;
        } finally {
            metrics.recordMutationLatency(type, result, Duration.ofNanos(System.nanoTime() - startNanos));
            MDC.remove(CorrelationContext.ACCOUNT_ID_MDC_KEY);
        }
    }

    private AppliedOutcome applyInTransaction(Instruction instruction) {
        balanceStore.applyLockTimeout(lockTimeoutMs);

        if (instruction.getInstructionId() != null && !processedInstructions.tryRecord(instruction)) {
            return AppliedOutcome.duplicate(instruction);
        }

        // Lock in a global order so opposite-direction transfers cannot deadlock
        List<String> lockOrder = instruction.affectedAccountIds().stream().sorted().toList();
        Map<String, Money> balances = new HashMap<>();
        for (String accountId : lockOrder) {
            Money balance = balanceStore.lockBalance(accountId)
                    .orElseThrow(() -> new AccountNotFoundException(accountId));
            balances.put(accountId, balance);
        }

        Money amount = instruction.getAmount();
        Map<String, Money> updated = new HashMap<>();
        switch (instruction.getKind()) {
            case DEPOSIT -> updated.put(instruction.getAccountId(),
                    credit(instruction.getAccountId(), balances.get(instruction.getAccountId()), amount));
            case WITHDRAWAL -> updated.put(instruction.getAccountId(),
                    debit(instruction.getAccountId(), balances.get(instruction.getAccountId()), amount));
            case TRANSFER -> {
                updated.put(instruction.getFromAccountId(),
                        debit(instruction.getFromAccountId(), balances.get(instruction.getFromAccountId()), amount));
                updated.put(instruction.getToAccountId(),
                        credit(instruction.getToAccountId(), balances.get(instruction.getToAccountId()), amount));
            }
        }

        // Postgres timestamps keep microseconds
        Instant now = Instant.now().truncatedTo(ChronoUnit.MICROS);
        List<LedgerEntry> entries = new ArrayList<>();
        for (String accountId : instruction.affectedAccountIds()) {
            Money newBalance = updated.get(accountId);
            balanceStore.updateBalance(accountId, newBalance);
            LedgerEntry entry = LedgerEntry.forAccount(instruction, accountId, newBalance, now);
            ledgerAppender.append(entry);
            entries.add(entry);
        }

        return AppliedOutcome.applied(instruction, entries);
    }

    private static Money debit(String accountId, Money balance, Money amount) {
        if (balance.isLessThan(amount)) {
            throw new InsufficientBalanceException(accountId, balance, amount);
        }
        return balance.minus(amount);
    }

    private static Money credit(String accountId, Money balance, Money amount) {
        try {
            return balance.plus(amount);
        } catch (IllegalArgumentException e) {
            throw new BalanceLimitExceededException(accountId, balance, amount, e);
        }
    }

    static boolean isTransient(Throwable e) {
        if (e instanceof TransientDataAccessException
                || e instanceof RecoverableDataAccessException
                || e instanceof DataAccessResourceFailureException
                || e instanceof CannotCreateTransactionException
                || e instanceof TransactionSystemException) {
            return true;
        }
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof SQLException) {
                String sqlState = ((SQLException) cause).getSQLState();
                if (sqlState != null && TRANSIENT_SQL_STATES.contains(sqlState)) {
                    return true;
                }
            }
            if (cause.getCause() == cause) {
                break;
            }
        }
        return false;
    }
}
