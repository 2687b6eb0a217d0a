package com.flagship.finance_ledger.journal.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

@Value
@Builder
@Jacksonized
public class JournalLineInput {

    @NotNull(message = "Account is required")
    Long accountId;

    @NotNull(message = "Currency is required")
    Long currencyId;

    @DecimalMin(value = "0", message = "Debit cannot be negative")
    BigDecimal debitAmount;

    @DecimalMin(value = "0", message = "Credit cannot be negative")
    BigDecimal creditAmount;

    @DecimalMin(value = "0", inclusive = false, message = "Exchange rate must be greater than 0")
    BigDecimal exchangeRate;

    String description;
}
