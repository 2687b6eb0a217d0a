package com.flagship.finance_ledger.discount.dto;

import com.flagship.finance_ledger.discount.DiscountType;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
@Builder
@Jacksonized
public class DiscountCodeRequest {

    String code;

    @NotNull(message = "Discount type must be percent or fixed")
    DiscountType type;

    @NotNull(message = "Discount value is required")
    @DecimalMin(value = "0", message = "Discount value cannot be negative")
    BigDecimal value;

    @DecimalMin(value = "0", message = "Minimum purchase cannot be negative")
    BigDecimal minPurchase;

    LocalDate validFrom;

    LocalDate validTo;

    @Min(value = 1, message = "Max uses must be at least 1")
    Integer maxUses;
}
