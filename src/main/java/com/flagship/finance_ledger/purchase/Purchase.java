package com.flagship.finance_ledger.purchase;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Purchase header. total_amount = &Sigma; item totals + additional_cost.
 */
@Value
@Builder
public class Purchase {
    Long id;
    Long supplierId;
    LocalDate date;
    String notes;
    Long currencyId;
    BigDecimal totalAmount;
    BigDecimal additionalCost;
    String batchNumber;
}
