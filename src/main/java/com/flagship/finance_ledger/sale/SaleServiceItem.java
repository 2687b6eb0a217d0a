package com.flagship.finance_ledger.sale;

import com.flagship.finance_ledger.discount.DiscountType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Service line of a sale; no inventory effect.
 */
@Value
@Builder(toBuilder = true)
public class SaleServiceItem {
    Long id;
    Long saleId;
    Long serviceId;
    String name;
    BigDecimal price;
    BigDecimal quantity;
    BigDecimal total;
    DiscountType discountType;
    BigDecimal discountValue;
}
