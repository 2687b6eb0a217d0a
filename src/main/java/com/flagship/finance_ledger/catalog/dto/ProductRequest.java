package com.flagship.finance_ledger.catalog.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

@Value
@Builder
@Jacksonized
public class ProductRequest {

    @NotBlank(message = "Product name is required")
    String name;

    String description;

    @DecimalMin(value = "0", message = "Price cannot be negative")
    BigDecimal price;

    Long currencyId;

    Long supplierId;

    String barCode;
}
