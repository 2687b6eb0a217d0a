package com.flagship.finance_ledger.payroll;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Salary of one employee for one (year, month). {@code month} is a month
 * name and is stored as given.
 */
@Value
@Builder
public class Salary {
    Long id;
    Long employeeId;
    int year;
    String month;
    BigDecimal amount;
    BigDecimal deductions;
    String notes;
}
