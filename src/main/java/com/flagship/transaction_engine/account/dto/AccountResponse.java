package com.flagship.transaction_engine.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.transaction_engine.account.Account;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class AccountResponse {

    @JsonProperty("account_id")
    String accountId;

    @JsonProperty("username")
    String username;

    @JsonProperty("phone")
    String phone;

    @JsonProperty("balance")
    BigDecimal balance;

    @JsonProperty("created_at")
    Instant createdAt;

    public static AccountResponse from(Account account) {
        return AccountResponse.builder()
            .accountId(account.getAccountId())
            .username(account.getUsername())
            .phone(account.getPhone())
            .balance(account.getBalance())
            .createdAt(account.getCreatedAt())
            .build();
    }
}
