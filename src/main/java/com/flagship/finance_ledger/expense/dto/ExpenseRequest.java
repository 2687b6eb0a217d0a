package com.flagship.finance_ledger.expense.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
@Builder
@Jacksonized
public class ExpenseRequest {

    @NotNull(message = "Expense type is required")
    Long expenseTypeId;

    /** Account the expense is paid from; null when paid outside the ledger. */
    Long accountId;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0", inclusive = false, message = "Amount must be greater than 0")
    BigDecimal amount;

    @NotBlank(message = "Currency is required")
    String currency;

    @DecimalMin(value = "0", inclusive = false, message = "Rate must be greater than 0")
    BigDecimal rate;

    @NotNull(message = "Date is required")
    LocalDate date;

    String billNo;

    String description;
}
