package com.flagship.finance_ledger.inventory;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A purchase item that still has stock. {@code remainingQuantity} is in the
 * batch's purchase unit, {@code remainingBase} in base units.
 */
@Value
@Builder
public class ProductBatch {
    Long purchaseItemId;
    Long purchaseId;
    String batchNumber;
    LocalDate purchaseDate;
    LocalDate expiryDate;
    Long unitId;
    BigDecimal perPrice;
    BigDecimal perUnit;
    BigDecimal wholesalePrice;
    BigDecimal retailPrice;
    BigDecimal amount;
    BigDecimal remainingQuantity;
    BigDecimal remainingBase;
}
