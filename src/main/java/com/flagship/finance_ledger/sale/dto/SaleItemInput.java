package com.flagship.finance_ledger.sale.dto;

import com.flagship.finance_ledger.discount.DiscountType;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

@Value
@Builder
@Jacksonized
public class SaleItemInput {

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

    /** Batch the line sells from; null for untracked stock. */
    Long purchaseItemId;

    /** retail or wholesale, stored as given. */
    String saleType;

    DiscountType discountType;

    BigDecimal discountValue;
}
