package com.flagship.transaction_engine.account;

import com.flagship.transaction_engine.money.Money;
import com.flagship.transaction_engine.transaction.AccountNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Account directory: opening accounts and looking them up.
 *
 * Balances are only read here. Every balance change goes through the balance mutator.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountService {

    private static final int PHONE_DIGITS = 10;
    private static final int USERNAME_MIN_LENGTH = 4;
    private static final int USERNAME_MAX_LENGTH = 50;

    private final AccountRepository repository;

    /**
     * Opens an account with a generated account id.
     *
     * @param openingBalance starting balance, zero when null
     * @throws IllegalArgumentException if the username or phone is invalid
     * @throws DuplicateAccountException if the phone is already registered
     */
    @Transactional
    public Account openAccount(String username, String phone, Money openingBalance) {
        String name = username == null ? "" : username.trim();
        if (name.length() < USERNAME_MIN_LENGTH || name.length() > USERNAME_MAX_LENGTH) {
            throw new IllegalArgumentException(
                "username must be between " + USERNAME_MIN_LENGTH + " and " + USERNAME_MAX_LENGTH + " characters");
        }
        if (!isValidPhone(phone)) {
            throw new IllegalArgumentException("phone must contain exactly " + PHONE_DIGITS + " digits");
        }
        String normalizedPhone = normalizePhone(phone);

        if (repository.existsByPhone(normalizedPhone)) {
            throw new DuplicateAccountException(normalizedPhone);
        }

        Money opening = openingBalance != null ? openingBalance : Money.ZERO;
        String accountId = UUID.randomUUID().toString();

        AccountEntity saved;
        try {
            saved = repository.saveAndFlush(
                AccountEntity.open(accountId, name, normalizedPhone, opening.toBigDecimal()));
        } catch (DataIntegrityViolationException e) {
            // Lost a race with a concurrent open for the same phone
            throw new DuplicateAccountException(normalizedPhone);
        }

        log.info("Opened account: accountId={}, openingBalance={}", accountId, opening);
        return saved.toDomain();
    }

    @Transactional(readOnly = true)
    public List<Account> listAccounts() {
        return repository.findAllByOrderByIdAsc().stream()
            .map(AccountEntity::toDomain)
            .toList();
    }

    /**
     * @throws AccountNotFoundException if no such account exists
     */
    @Transactional(readOnly = true)
    public Account getAccount(String accountId) {
        return repository.findByAccountId(accountId)
            .map(AccountEntity::toDomain)
            .orElseThrow(() -> new AccountNotFoundException(accountId));
    }

    @Transactional(readOnly = true)
    public boolean exists(String accountId) {
        return accountId != null && repository.existsByAccountId(accountId);
    }

    /**
     * Current committed balance. Not locked, so only advisory.
     */
    @Transactional(readOnly = true)
    public Money getBalance(String accountId) {
        return Money.of(getAccount(accountId).getBalance());
    }

    /**
     * A phone is valid when, ignoring spaces and dashes, it is exactly ten digits.
     */
    public static boolean isValidPhone(String phone) {
        if (phone == null) {
            return false;
        }
        String digits = normalizePhone(phone);
        return digits.length() == PHONE_DIGITS && digits.chars().allMatch(c -> c >= '0' && c <= '9');
    }

    static String normalizePhone(String phone) {
        return phone.replace("-", "").replace(" ", "");
    }
}
