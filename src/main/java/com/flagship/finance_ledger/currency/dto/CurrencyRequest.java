package com.flagship.finance_ledger.currency.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * Create or update payload for a currency.
 */
@Value
@Builder
@Jacksonized
public class CurrencyRequest {

    @NotBlank(message = "Currency name is required")
    String name;

    @JsonProperty("is_base")
    boolean base;

    @NotNull(message = "Rate is required")
    @DecimalMin(value = "0.000001", message = "Rate must be greater than 0")
    BigDecimal rate;
}
