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
public class SalaryRequest {

    @NotNull(message = "Employee is required")
    Long employeeId;

    @NotNull(message = "Year is required")
    Integer year;

    @NotBlank(message = "Month is required")
    String month;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0", message = "Amount cannot be negative")
    BigDecimal amount;

    /** Null means: sum the employee's deductions for the period. */
    BigDecimal deductions;

    String notes;
}
