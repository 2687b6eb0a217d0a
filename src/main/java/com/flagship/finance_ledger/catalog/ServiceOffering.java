package com.flagship.finance_ledger.catalog;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * A sellable service. Service lines on a sale have no inventory effect.
 */
@Value
@Builder
public class ServiceOffering {
    Long id;
    String name;
    BigDecimal price;
    Long currencyId;
    String description;
}
