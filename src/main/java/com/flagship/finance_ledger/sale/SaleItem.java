package com.flagship.finance_ledger.sale;

import com.flagship.finance_ledger.discount.DiscountType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Product line of a sale. With {@code purchaseItemId} set it consumes stock
 * from that batch.
 */
@Value
@Builder(toBuilder = true)
public class SaleItem {
    Long id;
    Long saleId;
    Long productId;
    Long unitId;
    BigDecimal perPrice;
    BigDecimal amount;
    BigDecimal total;
    Long purchaseItemId;
    String saleType;
    DiscountType discountType;
    BigDecimal discountValue;
}
