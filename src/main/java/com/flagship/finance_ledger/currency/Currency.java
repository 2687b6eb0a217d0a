package com.flagship.finance_ledger.currency;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * A currency and its rate: units of the base currency per 1 unit of this one.
 * At most one currency is the base currency.
 */
@Value
@Builder
public class Currency {
    Long id;
    String name;
    @JsonProperty("is_base")
    boolean base;
    BigDecimal rate;
}
