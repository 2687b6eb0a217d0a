package com.flagship.finance_ledger.payroll.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

@Value
@Builder
@Jacksonized
public class DeductionRequest {

    @NotNull(message = "Employee is required")
    Long employeeId;

    @NotNull(message = "Year is required")
    Integer year;

    @NotBlank(message = "Month is required")
    String month;

    @NotBlank(message = "Currency is required")
    String currency;

    @DecimalMin(value = "0", inclusive = false, message = "Rate must be greater than 0")
    BigDecimal rate;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0", inclusive = false, message = "Amount must be greater than 0")
    BigDecimal amount;
}
