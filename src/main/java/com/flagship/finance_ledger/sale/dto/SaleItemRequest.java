package com.flagship.finance_ledger.sale.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Item-level create or update of one sale line.
 */
@Value
@Builder
@Jacksonized
public class SaleItemRequest {

    Long saleId;

    @Valid
    @NotNull(message = "Item is required")
    SaleItemInput item;
}
