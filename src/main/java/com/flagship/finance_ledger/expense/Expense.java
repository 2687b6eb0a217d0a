package com.flagship.finance_ledger.expense;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * An expense; {@code currency} is the currency name and total = amount &times; rate.
 */
@Value
@Builder
public class Expense {
    Long id;
    Long expenseTypeId;
    Long accountId;
    BigDecimal amount;
    String currency;
    BigDecimal rate;
    BigDecimal total;
    LocalDate date;
    String billNo;
    String description;
}
