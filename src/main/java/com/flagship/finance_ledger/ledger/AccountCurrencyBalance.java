package com.flagship.finance_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Quantity of one currency held by an account, not converted to base.
 */
@Value
@Builder
public class AccountCurrencyBalance {
    Long accountId;
    Long currencyId;
    String currencyName;
    BigDecimal balance;
}
