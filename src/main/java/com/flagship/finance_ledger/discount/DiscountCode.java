package com.flagship.finance_ledger.discount;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Coupon applied to a sale subtotal. Validity bounds are inclusive.
 */
@Value
@Builder(toBuilder = true)
public class DiscountCode {
    Long id;
    String code;
    DiscountType type;
    BigDecimal value;
    BigDecimal minPurchase;
    LocalDate validFrom;
    LocalDate validTo;
    Integer maxUses;
    int useCount;

    public boolean isExhausted() {
        return maxUses != null && useCount >= maxUses;
    }
}
