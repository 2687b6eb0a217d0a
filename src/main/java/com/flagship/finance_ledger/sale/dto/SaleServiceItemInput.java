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
public class SaleServiceItemInput {

    @NotNull(message = "Service is required")
    Long serviceId;

    /** Defaults to the service's own name. */
    String name;

    @NotNull(message = "Price is required")
    @DecimalMin(value = "0", message = "Price cannot be negative")
    BigDecimal price;

    @DecimalMin(value = "0", inclusive = false, message = "Quantity must be greater than 0")
    BigDecimal quantity;

    DiscountType discountType;

    BigDecimal discountValue;

    public BigDecimal getQuantity() {
        return quantity != null ? quantity : BigDecimal.ONE;
    }
}
