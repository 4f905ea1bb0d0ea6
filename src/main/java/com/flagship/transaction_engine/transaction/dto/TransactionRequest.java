package com.flagship.transaction_engine.transaction.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Request DTO for submitting a deposit, withdrawal or transfer.
 *
 * Which account fields are required depends on the type; that is checked when the
 * request is turned into an instruction.
 */
@Value
public class TransactionRequest {

    @NotBlank(message = "Transaction type is required")
    @JsonProperty("type")
    String type;

    @JsonProperty("account_id")
    String accountId;

    @JsonProperty("from_account_id")
    String fromAccountId;

    @JsonProperty("to_account_id")
    String toAccountId;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @Digits(integer = 17, fraction = 2, message = "Amount allows at most 17 integer digits and 2 decimal places")
    @JsonProperty("amount")
    BigDecimal amount;
}
