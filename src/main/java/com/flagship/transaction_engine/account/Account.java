package com.flagship.transaction_engine.account;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * An account as seen by the directory: identity, owner and current balance.
 */
@Value
public class Account {
    String accountId;
    String username;
    String phone;
    BigDecimal balance;
    BigDecimal openingBalance;
    Instant createdAt;
}
