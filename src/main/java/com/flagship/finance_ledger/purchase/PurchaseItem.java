package com.flagship.finance_ledger.purchase;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A purchased line. Once sale items reference it, it is an inventory batch.
 */
@Value
@Builder
public class PurchaseItem {
    Long id;
    Long purchaseId;
    Long productId;
    Long unitId;
    BigDecimal perPrice;
    BigDecimal amount;
    BigDecimal total;
    BigDecimal perUnit;
    BigDecimal costPrice;
    BigDecimal wholesalePrice;
    BigDecimal retailPrice;
    LocalDate expiryDate;
}
