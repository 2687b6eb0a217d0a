package com.flagship.finance_ledger.purchase;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Payment toward a purchase. With an account it withdrew money from that
 * account; {@code currency} is the currency name.
 */
@Value
@Builder
public class PurchasePayment {
    Long id;
    Long purchaseId;
    Long accountId;
    BigDecimal amount;
    String currency;
    BigDecimal rate;
    BigDecimal total;
    LocalDate date;
    String notes;
}
