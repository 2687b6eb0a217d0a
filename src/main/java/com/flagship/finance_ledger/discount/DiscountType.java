package com.flagship.finance_ledger.discount;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of a line, order or code discount. Stored as lower-case text.
 */
public enum DiscountType {
    PERCENT,
    FIXED;

    @JsonValue
    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient parse: null, blank or unrecognized text yields null, which
     * the calculator treats as "no discount".
     */
    @JsonCreator
    public static DiscountType fromValue(String value) {
        if (value == null) {
            return null;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "percent" -> PERCENT;
            case "fixed" -> FIXED;
            default -> null;
        };
    }

    public static String toDbValue(DiscountType type) {
        return type != null ? type.dbValue() : null;
    }
}
