package com.flagship.transaction_engine.transaction;

import com.flagship.transaction_engine.money.Money;
import lombok.Getter;

/**
 * The debited account's balance is lower than the requested amount.
 * A business outcome, not a fault. Terminal.
 */
@Getter
public class InsufficientBalanceException extends MutationException {

    private final String accountId;
    private final Money balance;
    private final Money requested;

    public InsufficientBalanceException(String accountId, Money balance, Money requested) {
        super(String.format("Insufficient balance in account %s: %s < %s", accountId, balance, requested));
        this.accountId = accountId;
        this.balance = balance;
        this.requested = requested;
    }

    @Override
    public boolean isRetryable() {
        return false;
    }

    @Override
    public String reason() {
        return "insufficient_balance";
    }
}
