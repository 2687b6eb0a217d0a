package com.flagship.finance_ledger.purchase.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Item-level create or update on an existing purchase.
 */
@Value
@Builder
@Jacksonized
public class PurchaseItemRequest {

    Long purchaseId;

    @Valid
    @NotNull(message = "Item is required")
    PurchaseItemInput item;
}
