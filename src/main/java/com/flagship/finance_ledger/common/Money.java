package com.flagship.finance_ledger.common;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Rounding and null-handling helpers for monetary and quantity values.
 */
public final class Money {

    /** Scale of every NUMERIC(19,6) column. */
    public static final int STORAGE_SCALE = 6;

    private Money() {
    }

    /**
     * Rounds to two decimals, half away from zero.
     */
    public static BigDecimal round2(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP);
    }

    public static BigDecimal round6(BigDecimal value) {
        return value.setScale(STORAGE_SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }

    public static BigDecimal orOne(BigDecimal value) {
        return value != null ? value : BigDecimal.ONE;
    }

    public static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }

    public static BigDecimal multiply(BigDecimal a, BigDecimal b) {
        return orZero(a).multiply(orZero(b));
    }

    /**
     * Divides with storage precision; callers guarantee a non-zero divisor.
     */
    public static BigDecimal divide(BigDecimal dividend, BigDecimal divisor) {
        return dividend.divide(divisor, STORAGE_SCALE, RoundingMode.HALF_UP);
    }
}
