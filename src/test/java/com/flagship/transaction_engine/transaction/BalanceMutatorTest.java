package com.flagship.transaction_engine.transaction;

import com.flagship.transaction_engine.account.AccountService;
import com.flagship.transaction_engine.instruction.Instruction;
import com.flagship.transaction_engine.instruction.InstructionKind;
import com.flagship.transaction_engine.ledger.LedgerEntry;
import com.flagship.transaction_engine.ledger.LedgerQueryService;
import com.flagship.transaction_engine.ledger.Reconciliation;
import com.flagship.transaction_engine.money.Money;
import com.flagship.transaction_engine.support.TestAccounts;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Balance mutator against a real PostgreSQL.
 *
 * These tests try to break the balance invariants:
 * - money created or destroyed by a transfer
 * - a balance going below zero
 * - a partial write surviving a failure
 * - deadlocks between opposite-direction transfers
 */
@SpringBootTest
@Testcontainers
class BalanceMutatorTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("transaction_engine_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        // No broker needed here
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("consumer.enabled", () -> "false");
        registry.add("queue.topics.auto-create", () -> "false");
        registry.add("mutator.lock-timeout-ms", () -> "2000");
    }

    @Autowired
    private BalanceMutator mutator;

    @Autowired
    private AccountService accountService;

    @Autowired
    private LedgerQueryService ledgerQueryService;

    @Autowired
    private ProcessedInstructionStore processedInstructions;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private PlatformTransactionManager transactionManager;

    private String openAccount(String openingBalance) {
        return accountService.openAccount(
            TestAccounts.uniqueUsername(), TestAccounts.uniquePhone(), Money.of(openingBalance)
        ).getAccountId();
    }

    private Money balance(String accountId) {
        return accountService.getBalance(accountId);
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @Test
    @DisplayName("Deposit, withdrawal and transfer produce the expected balances and ledger")
    void testDepositWithdrawTransferScenario() {
        printTestHeader("Deposit / Withdrawal / Transfer Scenario");

        String a = openAccount("100.00");
        String b = openAccount("50.00");

        mutator.apply(Instruction.deposit(a, Money.of("50")));
        mutator.apply(Instruction.withdrawal(b, Money.of("30")));
        AppliedOutcome transfer = mutator.apply(Instruction.transfer(a, b, Money.of("70")));

        assertEquals(Money.of("80.00"), balance(a));
        assertEquals(Money.of("90.00"), balance(b));

        assertEquals(2, transfer.getEntries().size());
        assertFalse(transfer.isDuplicate());

        List<LedgerEntry> historyA = ledgerQueryService.history(a);
        assertEquals(2, historyA.size());
        assertEquals(InstructionKind.DEPOSIT, historyA.get(0).getKind());
        assertEquals(Money.of("150.00"), historyA.get(0).getCurrentBalance());
        assertEquals(InstructionKind.TRANSFER, historyA.get(1).getKind());
        assertEquals(Money.of("80.00"), historyA.get(1).getCurrentBalance());
        assertEquals(a, historyA.get(1).getFromAccountId());
        assertEquals(b, historyA.get(1).getToAccountId());

        List<LedgerEntry> historyB = ledgerQueryService.history(b);
        assertEquals(2, historyB.size());
        assertEquals(Money.of("20.00"), historyB.get(0).getCurrentBalance());
        assertEquals(Money.of("90.00"), historyB.get(1).getCurrentBalance());

        // Returned entries match what was stored
        assertEquals(transfer.getEntries().get(0), historyA.get(1));

        assertTrue(ledgerQueryService.reconcile(a).consistent());
        assertTrue(ledgerQueryService.reconcile(b).consistent());

        printSuccess("Balances and ledger agree: A=80.00, B=90.00");
    }

    @Test
    @DisplayName("A=100: deposit 50, rejected withdrawal of 200, then transfer 100 to an empty B")
    void testReferenceScenario() {
        printTestHeader("Reference Scenario - Ledger Counts Per Step");

        String a = openAccount("100.00");
        String b = openAccount("0.00");

        mutator.apply(Instruction.deposit(a, Money.of("50")));
        assertEquals(Money.of("150.00"), balance(a));
        assertEquals(1, ledgerQueryService.history(a).size());

        assertThrows(InsufficientBalanceException.class,
            () -> mutator.apply(Instruction.withdrawal(a, Money.of("200"))));
        assertEquals(Money.of("150.00"), balance(a));
        assertEquals(1, ledgerQueryService.history(a).size());

        mutator.apply(Instruction.transfer(a, b, Money.of("100")));
        assertEquals(Money.of("50.00"), balance(a));
        assertEquals(Money.of("100.00"), balance(b));

        List<LedgerEntry> historyA = ledgerQueryService.history(a);
        List<LedgerEntry> historyB = ledgerQueryService.history(b);
        assertEquals(2, historyA.size());
        assertEquals(1, historyB.size());
        assertEquals(new BigDecimal("50.00"), historyA.get(0).signedAmount());
        assertEquals(new BigDecimal("-100.00"), historyA.get(1).signedAmount());
        assertEquals(new BigDecimal("100.00"), historyB.get(0).signedAmount());

        // opening balance plus the signed ledger gives the current balance
        BigDecimal netA = historyA.stream().map(LedgerEntry::signedAmount).reduce(BigDecimal.ZERO, BigDecimal::add);
        assertEquals(balance(a).toBigDecimal(), new BigDecimal("100.00").add(netA));
        assertEquals(0, netA.compareTo(ledgerQueryService.reconcile(a).ledgerNet()));

        printSuccess("A=50.00, B=100.00, 2 entries for A and 1 for B");
    }

    @Nested
    @DisplayName("Business failures")
    class BusinessFailures {

        @Test
        @DisplayName("Withdrawal larger than the balance is rejected and changes nothing")
        void testInsufficientBalance() {
            String a = openAccount("100.00");

            InsufficientBalanceException e = assertThrows(InsufficientBalanceException.class,
                () -> mutator.apply(Instruction.withdrawal(a, Money.of("100.01"))));

            assertEquals(a, e.getAccountId());
            assertEquals(Money.of("100.00"), e.getBalance());
            assertEquals(Money.of("100.00"), balance(a));
            assertTrue(ledgerQueryService.history(a).isEmpty());
        }

        @Test
        @DisplayName("Withdrawing the exact balance leaves zero")
        void testWithdrawExactBalance() {
            String a = openAccount("42.42");

            mutator.apply(Instruction.withdrawal(a, Money.of("42.42")));

            assertEquals(Money.ZERO, balance(a));
        }

        @Test
        @DisplayName("Transfer exceeding the source balance leaves both accounts untouched")
        void testTransferInsufficientBalance() {
            String a = openAccount("10.00");
            String b = openAccount("10.00");

            assertThrows(InsufficientBalanceException.class,
                () -> mutator.apply(Instruction.transfer(a, b, Money.of("10.01"))));

            assertEquals(Money.of("10.00"), balance(a));
            assertEquals(Money.of("10.00"), balance(b));
        }

        @Test
        @DisplayName("Unknown account is reported and nothing is written")
        void testUnknownAccount() {
            String a = openAccount("10.00");

            AccountNotFoundException e = assertThrows(AccountNotFoundException.class,
                () -> mutator.apply(Instruction.transfer(a, "no-such-account", Money.of("5"))));

            assertEquals("no-such-account", e.getAccountId());
            assertFalse(e.isRetryable());
            assertEquals(Money.of("10.00"), balance(a));
            assertTrue(ledgerQueryService.history(a).isEmpty());
        }

        @Test
        @DisplayName("Deposit that would exceed the largest storable balance is rejected as final")
        void testBalanceLimitExceeded() {
            String a = openAccount("99999999999999999.00");

            BalanceLimitExceededException e = assertThrows(BalanceLimitExceededException.class,
                () -> mutator.apply(Instruction.deposit(a, Money.of("1.00"))));

            assertFalse(e.isRetryable());
            assertEquals(a, e.getAccountId());
            assertEquals(Money.of("99999999999999999.00"), balance(a));
            assertTrue(ledgerQueryService.history(a).isEmpty());
        }
    }

    @Test
    @DisplayName("A failure while appending the second ledger entry rolls back the whole transfer")
    void testAtomicityUnderLedgerFailure() {
        printTestHeader("Atomicity - Ledger Append Failure");

        String a = openAccount("100.00");
        String b = openAccount("100.00");

        // Make inserts of B's entry fail, after A's balance, B's balance and A's entry were written
        jdbcTemplate.execute(
            "CREATE OR REPLACE FUNCTION fail_ledger_insert() RETURNS TRIGGER AS $$ " +
            "BEGIN IF NEW.account_id = '" + b + "' THEN RAISE EXCEPTION 'injected ledger failure'; END IF; " +
            "RETURN NEW; END; $$ LANGUAGE plpgsql");
        jdbcTemplate.execute(
            "CREATE TRIGGER trg_fail_ledger_insert BEFORE INSERT ON ledger_entries " +
            "FOR EACH ROW EXECUTE FUNCTION fail_ledger_insert()");

        try {
            assertThrows(DataAccessException.class,
                () -> mutator.apply(Instruction.transfer(a, b, Money.of("40"))));
        } finally {
            jdbcTemplate.execute("DROP TRIGGER IF EXISTS trg_fail_ledger_insert ON ledger_entries");
            jdbcTemplate.execute("DROP FUNCTION IF EXISTS fail_ledger_insert()");
        }

        assertEquals(Money.of("100.00"), balance(a));
        assertEquals(Money.of("100.00"), balance(b));
        assertTrue(ledgerQueryService.history(a).isEmpty());
        assertTrue(ledgerQueryService.history(b).isEmpty());

        printSuccess("No partial state after the injected failure");
    }

    @Test
    @DisplayName("Opposite-direction transfers run concurrently without deadlock and conserve money")
    void testOppositeTransfersConserveMoney() throws Exception {
        printTestHeader("Concurrent Opposite-Direction Transfers");

        String a = openAccount("1000.00");
        String b = openAccount("1000.00");
        int transfersPerDirection = 25;
        int threadCount = 8;

        CountDownLatch startLatch = new CountDownLatch(1);
        AtomicInteger failures = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);

        try {
            for (int i = 0; i < transfersPerDirection; i++) {
                executor.submit(() -> runAfter(startLatch, failures,
                    () -> mutator.apply(Instruction.transfer(a, b, Money.of("3.00")))));
                executor.submit(() -> runAfter(startLatch, failures,
                    () -> mutator.apply(Instruction.transfer(b, a, Money.of("1.00")))));
            }
            startLatch.countDown();
        } finally {
            executor.shutdown();
        }
        assertTrue(executor.awaitTermination(60, TimeUnit.SECONDS), "transfers did not finish");

        assertEquals(0, failures.get(), "no transfer should fail or deadlock");
        assertEquals(Money.of("950.00"), balance(a));
        assertEquals(Money.of("1050.00"), balance(b));
        assertEquals(Money.of("2000.00"), balance(a).plus(balance(b)));
        assertEquals(2 * transfersPerDirection, ledgerQueryService.history(a).size());
        assertTrue(ledgerQueryService.reconcile(a).consistent());
        assertTrue(ledgerQueryService.reconcile(b).consistent());

        printSuccess("Total preserved at 2000.00 across " + (2 * transfersPerDirection) + " transfers");
    }

    @Test
    @DisplayName("Concurrent withdrawals never overdraw the account")
    void testConcurrentWithdrawalsNeverOverdraw() throws Exception {
        printTestHeader("Concurrent Withdrawals - Non-Negativity");

        String a = openAccount("100.00");
        int attempts = 20;

        CountDownLatch startLatch = new CountDownLatch(1);
        AtomicInteger succeeded = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(10);

        try {
            for (int i = 0; i < attempts; i++) {
                executor.submit(() -> {
                    try {
                        startLatch.await();
                        mutator.apply(Instruction.withdrawal(a, Money.of("10.00")));
                        succeeded.incrementAndGet();
                    } catch (InsufficientBalanceException e) {
                        rejected.incrementAndGet();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                });
            }
            startLatch.countDown();
        } finally {
            executor.shutdown();
        }
        assertTrue(executor.awaitTermination(60, TimeUnit.SECONDS));

        assertEquals(10, succeeded.get());
        assertEquals(10, rejected.get());
        assertEquals(Money.ZERO, balance(a));

        printSuccess("Exactly 10 of 20 withdrawals succeeded, balance is 0.00");
    }

    @Nested
    @DisplayName("Redelivery")
    class Redelivery {

        @Test
        @DisplayName("Without an instruction id, applying the same instruction twice applies it twice")
        void testRedeliveryWithoutKeyReapplies() {
            String a = openAccount("0.00");
            Instruction deposit = Instruction.deposit(a, Money.of("25"));

            mutator.apply(deposit);
            mutator.apply(deposit);

            assertEquals(Money.of("50.00"), balance(a));
            assertEquals(2, ledgerQueryService.history(a).size());
        }

        @Test
        @DisplayName("With an instruction id, the second application is a no-op")
        void testRedeliveryWithKeyIsDeduplicated() {
            String a = openAccount("0.00");
            Instruction deposit = Instruction.deposit(a, Money.of("25")).withInstructionId(UUID.randomUUID());

            AppliedOutcome first = mutator.apply(deposit);
            AppliedOutcome second = mutator.apply(deposit);

            assertFalse(first.isDuplicate());
            assertTrue(second.isDuplicate());
            assertTrue(second.getEntries().isEmpty());
            assertEquals(Money.of("25.00"), balance(a));
            assertTrue(processedInstructions.isRecorded(deposit.getInstructionId()));
            assertEquals(deposit.getInstructionId(), ledgerQueryService.history(a).get(0).getInstructionId());
        }

        @Test
        @DisplayName("A rejected instruction id is not recorded, so a later retry can still apply")
        void testRejectedKeyNotRecorded() {
            String a = openAccount("0.00");
            Instruction withdrawal = Instruction.withdrawal(a, Money.of("5")).withInstructionId(UUID.randomUUID());

            assertThrows(InsufficientBalanceException.class, () -> mutator.apply(withdrawal));
            assertFalse(processedInstructions.isRecorded(withdrawal.getInstructionId()));
            mutator.apply(Instruction.deposit(a, Money.of("5")));

            assertFalse(mutator.apply(withdrawal).isDuplicate());
            assertEquals(Money.ZERO, balance(a));
        }
    }

    @Test
    @DisplayName("A row lock held past the lock timeout surfaces as a retryable store failure")
    void testLockTimeoutIsRetryable() throws Exception {
        printTestHeader("Lock Timeout - Store Unavailable");

        String a = openAccount("10.00");
        CountDownLatch locked = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        TransactionTemplate holder = new TransactionTemplate(transactionManager);

        Future<?> lockHolder = executor.submit(() -> holder.executeWithoutResult(status -> {
            jdbcTemplate.queryForList("SELECT balance FROM accounts WHERE account_id = ? FOR UPDATE", a);
            locked.countDown();
            try {
                release.await(30, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }));

        try {
            assertTrue(locked.await(10, TimeUnit.SECONDS));

            StoreUnavailableException e = assertThrows(StoreUnavailableException.class,
                () -> mutator.apply(Instruction.deposit(a, Money.of("1"))));
            assertTrue(e.isRetryable());
        } finally {
            release.countDown();
            lockHolder.get(10, TimeUnit.SECONDS);
            executor.shutdown();
        }

        assertEquals(Money.of("10.00"), balance(a));
        printSuccess("Lock timeout reported as retryable, balance unchanged");
    }

    @Test
    @DisplayName("Ledger entries cannot be updated or deleted")
    void testLedgerIsAppendOnly() {
        String a = openAccount("0.00");
        mutator.apply(Instruction.deposit(a, Money.of("10")));

        assertThrows(DataAccessException.class,
            () -> jdbcTemplate.update("UPDATE ledger_entries SET amount = 1 WHERE account_id = ?", a));
        assertThrows(DataAccessException.class,
            () -> jdbcTemplate.update("DELETE FROM ledger_entries WHERE account_id = ?", a));

        Reconciliation reconciliation = ledgerQueryService.reconcile(a);
        assertTrue(reconciliation.consistent());
        assertEquals(1, reconciliation.entryCount());
    }

    private static void runAfter(CountDownLatch startLatch, AtomicInteger failures, Runnable action) {
        try {
            startLatch.await();
            action.run();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            failures.incrementAndGet();
            System.out.println("Transfer failed: " + e.getMessage());
        }
    }
}
