package com.flagship.finance_ledger.expense.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class ExpenseTypeRequest {

    @NotBlank(message = "Name is required")
    String name;
}
