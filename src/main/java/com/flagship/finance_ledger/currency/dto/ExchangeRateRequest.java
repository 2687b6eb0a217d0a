package com.flagship.finance_ledger.currency.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
@Builder
@Jacksonized
public class ExchangeRateRequest {

    @NotNull(message = "From currency is required")
    Long fromCurrencyId;

    @NotNull(message = "To currency is required")
    Long toCurrencyId;

    @NotNull(message = "Rate is required")
    @DecimalMin(value = "0.000001", message = "Rate must be greater than 0")
    BigDecimal rate;

    @NotNull(message = "Date is required")
    LocalDate date;
}
