package com.flagship.finance_ledger.purchase.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
@Builder
@Jacksonized
public class PurchasePaymentRequest {

    @NotNull(message = "Purchase is required")
    Long purchaseId;

    Long accountId;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0", inclusive = false, message = "Amount must be greater than 0")
    BigDecimal amount;

    @NotBlank(message = "Currency is required")
    String currency;

    BigDecimal rate;

    @NotNull(message = "Date is required")
    LocalDate date;

    String notes;
}
