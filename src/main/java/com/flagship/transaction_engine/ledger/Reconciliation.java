package com.flagship.transaction_engine.ledger;

import java.math.BigDecimal;

/**
 * Result of checking an account's stored balance against its ledger.
 *
 * The invariant: {@code actualBalance == openingBalance + ledgerNet}, where
 * {@code ledgerNet} is the signed sum of the account's committed entries.
 */
public record Reconciliation(
    String accountId,
    BigDecimal openingBalance,
    BigDecimal ledgerNet,
    BigDecimal expectedBalance,
    BigDecimal actualBalance,
    long entryCount
) {

    public boolean consistent() {
        return expectedBalance.compareTo(actualBalance) == 0;
    }
}
