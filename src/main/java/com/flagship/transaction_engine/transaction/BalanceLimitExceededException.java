package com.flagship.transaction_engine.transaction;

import com.flagship.transaction_engine.money.Money;
import lombok.Getter;

/**
 * The credited account's balance would exceed the largest storable amount. Terminal.
 */
@Getter
public class BalanceLimitExceededException extends MutationException {

    private final String accountId;
    private final Money balance;
    private final Money requested;

    public BalanceLimitExceededException(String accountId, Money balance, Money requested, Throwable cause) {
        super(String.format("Crediting %s to account %s (balance %s) exceeds the balance limit",
                requested, accountId, balance), cause);
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
        return "balance_limit_exceeded";
    }
}
