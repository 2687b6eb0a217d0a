package com.flagship.finance_ledger.sale.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class SaleServiceItemRequest {

    Long saleId;

    @Valid
    @NotNull(message = "Service item is required")
    SaleServiceItemInput item;
}
