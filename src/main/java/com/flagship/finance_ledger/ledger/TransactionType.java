package com.flagship.finance_ledger.ledger;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Direction of an account transaction audit row.
 */
public enum TransactionType {
    DEPOSIT,
    WITHDRAW;

    @JsonValue
    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static TransactionType fromDbValue(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
