package com.flagship.finance_ledger.common;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Stored additional cost row; {@code ownerId} is the sale or purchase id.
 */
@Value
public class AdditionalCost {
    Long id;
    Long ownerId;
    String name;
    BigDecimal amount;
}
