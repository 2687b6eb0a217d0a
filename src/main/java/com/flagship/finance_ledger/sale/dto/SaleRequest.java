package com.flagship.finance_ledger.sale.dto;

import com.flagship.finance_ledger.common.AdditionalCostInput;
import com.flagship.finance_ledger.discount.DiscountType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Create or full-replace request for a sale.
 */
@Value
@Builder
@Jacksonized
public class SaleRequest {

    @NotNull(message = "Customer is required")
    Long customerId;

    @NotNull(message = "Date is required")
    LocalDate date;

    String notes;

    Long currencyId;

    @DecimalMin(value = "0", inclusive = false, message = "Exchange rate must be greater than 0")
    BigDecimal exchangeRate;

    @DecimalMin(value = "0", message = "Paid amount cannot be negative")
    BigDecimal paidAmount;

    @Valid
    List<AdditionalCostInput> additionalCosts;

    @Valid
    List<SaleItemInput> items;

    @Valid
    List<SaleServiceItemInput> serviceItems;

    DiscountType orderDiscountType;

    BigDecimal orderDiscountValue;

    Long discountCodeId;

    public BigDecimal getExchangeRate() {
        return exchangeRate != null ? exchangeRate : BigDecimal.ONE;
    }

    public List<AdditionalCostInput> getAdditionalCosts() {
        return additionalCosts != null ? additionalCosts : List.of();
    }

    public List<SaleItemInput> getItems() {
        return items != null ? items : List.of();
    }

    public List<SaleServiceItemInput> getServiceItems() {
        return serviceItems != null ? serviceItems : List.of();
    }
}
