package com.flagship.finance_ledger.purchase.dto;

import com.flagship.finance_ledger.common.AdditionalCostInput;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.util.List;

@Value
@Builder
@Jacksonized
public class PurchaseRequest {

    @NotNull(message = "Supplier is required")
    Long supplierId;

    @NotNull(message = "Date is required")
    LocalDate date;

    String notes;

    Long currencyId;

    @Valid
    List<AdditionalCostInput> additionalCosts;

    @Valid
    @NotEmpty(message = "Purchase must have at least one item")
    List<PurchaseItemInput> items;

    public List<AdditionalCostInput> getAdditionalCosts() {
        return additionalCosts != null ? additionalCosts : List.of();
    }

    public List<PurchaseItemInput> getItems() {
        return items != null ? items : List.of();
    }
}
