package com.flagship.finance_ledger.payroll;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class Deduction {
    Long id;
    Long employeeId;
    int year;
    String month;
    String currency;
    BigDecimal rate;
    BigDecimal amount;
}
