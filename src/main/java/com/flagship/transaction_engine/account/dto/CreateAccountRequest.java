package com.flagship.transaction_engine.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Request DTO for opening an account.
 */
@Value
public class CreateAccountRequest {

    @NotBlank(message = "Username is required")
    @Size(min = 4, max = 50, message = "Username must be between 4 and 50 characters")
    @JsonProperty("username")
    String username;

    @NotBlank(message = "Phone is required")
    @JsonProperty("phone")
    String phone;

    @DecimalMin(value = "0.00", message = "Opening balance cannot be negative")
    @Digits(integer = 17, fraction = 2, message = "Opening balance allows at most 2 decimal places")
    @JsonProperty("opening_balance")
    BigDecimal openingBalance;
}
