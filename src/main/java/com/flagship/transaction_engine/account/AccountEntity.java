package com.flagship.transaction_engine.account;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * JPA entity for the accounts table.
 *
 * The balance column is owned by the balance mutator, which writes it under a row
 * lock through {@link AccountBalanceStore}. JPA only inserts it, never updates it.
 */
@Entity
@Table(
    name = "accounts",
    indexes = {
        @Index(name = "idx_accounts_account_id", columnList = "account_id", unique = true),
        @Index(name = "idx_accounts_phone", columnList = "phone", unique = true)
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AccountEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "account_id", nullable = false, unique = true, updatable = false)
    private String accountId;

    @Column(nullable = false, length = 50)
    private String username;

    @Column(nullable = false, unique = true, length = 10)
    private String phone;

    @Column(nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal balance;

    @Column(name = "opening_balance", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal openingBalance;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    static AccountEntity open(String accountId, String username, String phone, BigDecimal openingBalance) {
        return new AccountEntity(null, accountId, username, phone, openingBalance, openingBalance, null);
    }

    public Account toDomain() {
        return new Account(accountId, username, phone, balance, openingBalance, createdAt);
    }
}
