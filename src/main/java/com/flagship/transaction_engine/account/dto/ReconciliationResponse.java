package com.flagship.transaction_engine.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.transaction_engine.ledger.Reconciliation;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Response DTO comparing an account's stored balance with its ledger.
 */
@Value
@Builder
public class ReconciliationResponse {

    @JsonProperty("account_id")
    String accountId;

    @JsonProperty("opening_balance")
    BigDecimal openingBalance;

    @JsonProperty("ledger_net")
    BigDecimal ledgerNet;

    @JsonProperty("expected_balance")
    BigDecimal expectedBalance;

    @JsonProperty("actual_balance")
    BigDecimal actualBalance;

    @JsonProperty("entry_count")
    long entryCount;

    @JsonProperty("consistent")
    boolean consistent;

    public static ReconciliationResponse from(Reconciliation reconciliation) {
        return ReconciliationResponse.builder()
            .accountId(reconciliation.accountId())
            .openingBalance(reconciliation.openingBalance())
            .ledgerNet(reconciliation.ledgerNet())
            .expectedBalance(reconciliation.expectedBalance())
            .actualBalance(reconciliation.actualBalance())
            .entryCount(reconciliation.entryCount())
            .consistent(reconciliation.consistent())
            .build();
    }
}
