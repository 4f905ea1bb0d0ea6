package com.flagship.transaction_engine.transaction;

import lombok.Getter;

/**
 * The referenced account does not exist. Terminal.
 */
@Getter
public class AccountNotFoundException extends MutationException {

    private final String accountId;

    public AccountNotFoundException(String accountId) {
        super("Account not found: " + accountId);
        this.accountId = accountId;
    }

    @Override
    public boolean isRetryable() {
        return false;
    }

    @Override
    public String reason() {
        return "account_not_found";
    }
}
