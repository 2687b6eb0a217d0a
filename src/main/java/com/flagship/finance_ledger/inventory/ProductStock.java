package com.flagship.finance_ledger.inventory;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class ProductStock {
    Long productId;
    BigDecimal totalBase;
    /** Present only when a target unit was requested. */
    BigDecimal totalInUnit;
}
