package com.flagship.finance_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Deposit or withdrawal request. {@code currency} is a currency name;
 * {@code rate} defaults to the currency's current rate.
 */
@Value
@Builder
@Jacksonized
public class AccountTransactionRequest {

    @NotNull(message = "Account is required")
    Long accountId;

    BigDecimal amount;

    @NotBlank(message = "Currency is required")
    String currency;

    BigDecimal rate;

    @NotNull(message = "Transaction date is required")
    LocalDate transactionDate;

    @JsonProperty("is_full")
    boolean full;

    String notes;
}
