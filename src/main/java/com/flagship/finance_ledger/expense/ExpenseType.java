package com.flagship.finance_ledger.expense;

import lombok.Value;

@Value
public class ExpenseType {
    Long id;
    String name;
}
