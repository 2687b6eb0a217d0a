package com.flagship.finance_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

@Value
@Builder
@Jacksonized
public class AccountRequest {

    @NotBlank(message = "Account name is required")
    String name;

    Long currencyId;

    Long coaCategoryId;

    String accountCode;

    String accountType;

    BigDecimal initialBalance;

    @JsonProperty("is_active")
    @Builder.Default
    boolean active = true;

    String notes;
}
