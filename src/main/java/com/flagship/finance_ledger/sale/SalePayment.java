package com.flagship.finance_ledger.sale;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
@Builder
public class SalePayment {
    Long id;
    Long saleId;
    Long accountId;
    Long currencyId;
    BigDecimal exchangeRate;
    BigDecimal amount;
    BigDecimal baseAmount;
    LocalDate date;
}
