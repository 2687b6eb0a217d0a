package com.flagship.finance_ledger.sale.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Payment toward a sale. Currency falls back to the sale's currency, then to
 * the base currency.
 */
@Value
@Builder
@Jacksonized
public class SalePaymentRequest {

    @NotNull(message = "Sale is required")
    Long saleId;

    Long accountId;

    Long currencyId;

    @DecimalMin(value = "0", inclusive = false, message = "Exchange rate must be greater than 0")
    BigDecimal exchangeRate;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0", inclusive = false, message = "Amount must be greater than 0")
    BigDecimal amount;

    @NotNull(message = "Date is required")
    LocalDate date;
}
