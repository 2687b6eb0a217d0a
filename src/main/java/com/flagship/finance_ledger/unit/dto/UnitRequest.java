package com.flagship.finance_ledger.unit.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

@Value
@Builder
@Jacksonized
public class UnitRequest {

    @NotBlank(message = "Unit name is required")
    String name;

    Long groupId;

    @NotNull(message = "Ratio is required")
    BigDecimal ratio;

    @JsonProperty("is_base")
    boolean base;
}
