package com.flagship.finance_ledger.payroll;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
@Builder
public class Employee {
    Long id;
    String fullName;
    String phone;
    String email;
    String address;
    String position;
    LocalDate hireDate;
    BigDecimal baseSalary;
    String notes;
}
