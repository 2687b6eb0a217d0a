package com.flagship.finance_ledger.inventory;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Purchased and consumed quantity of one batch, both in base units.
 */
@Value
@Builder
public class BatchStock {
    Long purchaseItemId;
    Long productId;
    String batchNumber;
    BigDecimal purchasedBase;
    BigDecimal consumedBase;

    public BigDecimal getRemainingBase() {
        return purchasedBase.subtract(consumedBase);
    }

    public String label() {
        return batchNumber != null ? batchNumber + " (item " + purchaseItemId + ")" : "item " + purchaseItemId;
    }
}
