package com.flagship.transaction_engine.account;

import com.flagship.transaction_engine.money.Money;
import com.flagship.transaction_engine.transaction.AccountNotFoundException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.math.BigDecimal;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AccountServiceTest {

    @Mock
    private AccountRepository accountRepository;

    @InjectMocks
    private AccountService accountService;

    // --- OPEN ACCOUNT ---

    @Test
    @DisplayName("Open: stores the normalized phone and the opening balance")
    void openAccount_ShouldNormalizePhone() {
        when(accountRepository.existsByPhone("5551234567")).thenReturn(false);
        when(accountRepository.saveAndFlush(any(AccountEntity.class))).thenAnswer(inv -> inv.getArgument(0));

        Account account = accountService.openAccount("alice", "555-123 4567", Money.of("75.5"));

        assertEquals("5551234567", account.getPhone());
        assertEquals(new BigDecimal("75.50"), account.getBalance());
        assertEquals(new BigDecimal("75.50"), account.getOpeningBalance());
        assertNotNull(account.getAccountId());
        verify(accountRepository).saveAndFlush(argThat(entity -> entity.getUsername().equals("alice")));
    }

    @Test
    @DisplayName("Open: missing opening balance starts at zero")
    void openAccount_ShouldDefaultToZero() {
        when(accountRepository.saveAndFlush(any(AccountEntity.class))).thenAnswer(inv -> inv.getArgument(0));

        Account account = accountService.openAccount("bobby", "5550000000", null);

        assertEquals(0, BigDecimal.ZERO.compareTo(account.getBalance()));
    }

    @Test
    @DisplayName("Open: duplicate phone is rejected before saving")
    void openAccount_ShouldRejectDuplicatePhone() {
        when(accountRepository.existsByPhone("5551234567")).thenReturn(true);

        assertThrows(DuplicateAccountException.class,
            () -> accountService.openAccount("alice", "5551234567", Money.ZERO));

        verify(accountRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("Open: a unique-constraint race is reported as a duplicate")
    void openAccount_ShouldMapConstraintViolation() {
        when(accountRepository.saveAndFlush(any(AccountEntity.class)))
            .thenThrow(new DataIntegrityViolationException("duplicate key value violates unique constraint"));

        assertThrows(DuplicateAccountException.class,
            () -> accountService.openAccount("alice", "5551234567", Money.ZERO));
    }

    @Test
    @DisplayName("Open: invalid username or phone is a validation error")
    void openAccount_ShouldValidateInput() {
        assertThrows(IllegalArgumentException.class,
            () -> accountService.openAccount("abc", "5551234567", Money.ZERO));
        assertThrows(IllegalArgumentException.class,
            () -> accountService.openAccount("a".repeat(51), "5551234567", Money.ZERO));
        assertThrows(IllegalArgumentException.class,
            () -> accountService.openAccount("alice", "555123456", Money.ZERO));
        assertThrows(IllegalArgumentException.class,
            () -> accountService.openAccount("alice", "555123456a", Money.ZERO));

        verifyNoInteractions(accountRepository);
    }

    @Test
    @DisplayName("Phone: ten digits once spaces and dashes are removed")
    void isValidPhone() {
        assertTrue(AccountService.isValidPhone("0123456789"));
        assertTrue(AccountService.isValidPhone("012-345-6789"));
        assertTrue(AccountService.isValidPhone("012 345 6789"));
        assertFalse(AccountService.isValidPhone("+10123456789"));
        assertFalse(AccountService.isValidPhone("01234567890"));
        assertFalse(AccountService.isValidPhone(null));
        assertFalse(AccountService.isValidPhone(""));
        // Arabic-Indic and full-width digits
        assertFalse(AccountService.isValidPhone("\u0660\u0661\u0662\u0663\u0664\u0665\u0666\u0667\u0668\u0669"));
        assertFalse(AccountService.isValidPhone("\uFF10123456789"));
    }

    // --- LOOKUP ---

    @Test
    @DisplayName("Get: unknown account throws AccountNotFoundException")
    void getAccount_ShouldThrow_WhenMissing() {
        when(accountRepository.findByAccountId("ghost")).thenReturn(Optional.empty());

        AccountNotFoundException e = assertThrows(AccountNotFoundException.class,
            () -> accountService.getAccount("ghost"));
        assertEquals("ghost", e.getAccountId());
    }

    @Test
    @DisplayName("Exists: null id is never an account")
    void exists_ShouldBeFalse_ForNull() {
        assertFalse(accountService.exists(null));
        verifyNoInteractions(accountRepository);
    }
}
