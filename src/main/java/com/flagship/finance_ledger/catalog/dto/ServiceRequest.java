package com.flagship.finance_ledger.catalog.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

@Value
@Builder
@Jacksonized
public class ServiceRequest {

    @NotBlank(message = "Service name is required")
    String name;

    @NotNull(message = "Price is required")
    @DecimalMin(value = "0", message = "Price cannot be negative")
    BigDecimal price;

    Long currencyId;

    String description;
}
