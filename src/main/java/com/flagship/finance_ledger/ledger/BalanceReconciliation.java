package com.flagship.finance_ledger.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Per-currency account balance compared with the net of journal lines
 * posted to the same account and currency.
 */
@Value
@Builder
public class BalanceReconciliation {
    Long accountId;
    Long currencyId;
    BigDecimal accountBalance;
    BigDecimal journalDebits;
    BigDecimal journalCredits;
    BigDecimal journalBalance;
    BigDecimal difference;
    @JsonProperty("is_balanced")
    boolean balanced;
}
