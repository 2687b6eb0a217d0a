package com.flagship.finance_ledger.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * A money account. {@code currentBalance} is a cache maintained by
 * {@link BalanceLedger}: initial balance plus every per-currency balance
 * converted at the currency's rate.
 */
@Value
@Builder
public class Account {
    Long id;
    String name;
    Long currencyId;
    Long coaCategoryId;
    String accountCode;
    String accountType;
    BigDecimal initialBalance;
    BigDecimal currentBalance;
    @JsonProperty("is_active")
    boolean active;
    String notes;
}
