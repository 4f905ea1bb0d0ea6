package com.flagship.transaction_engine.ledger.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.transaction_engine.ledger.LedgerEntry;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Response DTO for one ledger entry.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LedgerEntryResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("account_id")
    String accountId;

    @JsonProperty("from_account_id")
    String fromAccountId;

    @JsonProperty("to_account_id")
    String toAccountId;

    @JsonProperty("type")
    String type;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("current_balance")
    BigDecimal currentBalance;

    @JsonProperty("instruction_id")
    UUID instructionId;

    public static LedgerEntryResponse from(LedgerEntry entry) {
        return LedgerEntryResponse.builder()
            .id(entry.getId())
            .accountId(entry.getAccountId())
            .fromAccountId(entry.getFromAccountId())
            .toAccountId(entry.getToAccountId())
            .type(entry.getKind().wireName())
            .amount(entry.getAmount().toBigDecimal())
            .createdAt(entry.getCreatedAt())
            .currentBalance(entry.getCurrentBalance().toBigDecimal())
            .instructionId(entry.getInstructionId())
            .build();
    }
}
