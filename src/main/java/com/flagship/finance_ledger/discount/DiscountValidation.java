package com.flagship.finance_ledger.discount;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Outcome of a successful code check: the code's kind and the discount it
 * yields on the given subtotal.
 */
@Value
public class DiscountValidation {
    Long discountCodeId;
    DiscountType type;
    BigDecimal amount;
}
