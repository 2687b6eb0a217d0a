package com.flagship.finance_ledger.inventory;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Quantity a sale line wants to take from a batch, in the line's unit.
 */
@Value
public class BatchDemand {
    Long purchaseItemId;
    Long productId;
    long unitId;
    BigDecimal amount;
}
