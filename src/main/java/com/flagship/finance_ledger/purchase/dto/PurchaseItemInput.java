package com.flagship.finance_ledger.purchase.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Purchase line. {@code id} is set when an update keeps an existing line.
 */
@Value
@Builder
@Jacksonized
public class PurchaseItemInput {

    Long id;

    @NotNull(message = "Product is required")
    Long productId;

    @NotNull(message = "Unit is required")
    Long unitId;

    @NotNull(message = "Price is required")
    @DecimalMin(value = "0", message = "Price cannot be negative")
    BigDecimal perPrice;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0", inclusive = false, message = "Amount must be greater than 0")
    BigDecimal amount;

    BigDecimal perUnit;

    BigDecimal costPrice;

    BigDecimal wholesalePrice;

    BigDecimal retailPrice;

    LocalDate expiryDate;
}
