package com.flagship.finance_ledger.sale.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

@Value
@Builder
@Jacksonized
public class SaleAdditionalCostRequest {

    Long saleId;

    @NotBlank(message = "Cost name is required")
    String name;

    @NotNull(message = "Cost amount is required")
    @DecimalMin(value = "0", message = "Cost amount cannot be negative")
    BigDecimal amount;
}
