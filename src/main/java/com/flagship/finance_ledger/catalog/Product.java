package com.flagship.finance_ledger.catalog;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class Product {
    Long id;
    String name;
    String description;
    BigDecimal price;
    Long currencyId;
    Long supplierId;
    String barCode;
}
