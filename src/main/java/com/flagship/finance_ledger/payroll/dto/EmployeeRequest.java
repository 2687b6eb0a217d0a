package com.flagship.finance_ledger.payroll.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
@Builder
@Jacksonized
public class EmployeeRequest {

    @NotBlank(message = "Full name is required")
    String fullName;

    @NotBlank(message = "Phone is required")
    String phone;

    String email;

    @NotBlank(message = "Address is required")
    String address;

    String position;

    LocalDate hireDate;

    BigDecimal baseSalary;

    String notes;
}
