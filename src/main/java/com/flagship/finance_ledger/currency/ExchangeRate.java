package com.flagship.finance_ledger.currency;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Historical rate: 1 unit of the "from" currency is worth {@code rate} units of the "to" currency.
 */
@Value
@Builder
public class ExchangeRate {
    Long id;
    Long fromCurrencyId;
    Long toCurrencyId;
    BigDecimal rate;
    LocalDate date;
}
