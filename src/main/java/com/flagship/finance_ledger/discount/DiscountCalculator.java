package com.flagship.finance_ledger.discount;

import com.flagship.finance_ledger.common.Money;

import java.math.BigDecimal;

/**
 * Computes a discount amount from a subtotal. Pure and deterministic.
 *
 * <ul>
 *   <li>subtotal &le; 0 or unknown kind: 0</li>
 *   <li>percent: value clamped to [0, 100], amount = round2(subtotal &times; value / 100)</li>
 *   <li>fixed: amount = round2(min(subtotal, value)), never above the subtotal</li>
 * </ul>
 */
public final class DiscountCalculator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private DiscountCalculator() {
    }

    public static BigDecimal computeDiscount(BigDecimal subtotal, DiscountType kind, BigDecimal value) {
        if (subtotal == null || subtotal.signum() <= 0 || kind == null) {
            return BigDecimal.ZERO.setScale(2);
        }
        BigDecimal v = Money.orZero(value);
        return switch (kind) {
            case PERCENT -> {
                BigDecimal pct = v.max(BigDecimal.ZERO).min(HUNDRED);
                yield Money.round2(subtotal.multiply(pct).divide(HUNDRED));
            }
            case FIXED -> Money.round2(subtotal.min(v.max(BigDecimal.ZERO)));
        };
    }

    /**
     * Overload for stored text kinds; unrecognized text means no discount.
     */
    public static BigDecimal computeDiscount(BigDecimal subtotal, String kind, BigDecimal value) {
        return computeDiscount(subtotal, DiscountType.fromValue(kind), value);
    }
}
