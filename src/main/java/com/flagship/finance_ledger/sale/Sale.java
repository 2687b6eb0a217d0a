package com.flagship.finance_ledger.sale;

import com.flagship.finance_ledger.discount.DiscountType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Sale header with its denormalized totals:
 * total_amount = subtotal &minus; order_discount_amount + additional_cost,
 * base_amount = total_amount &times; exchange_rate,
 * paid_amount = &Sigma; payment amounts.
 */
@Value
@Builder(toBuilder = true)
public class Sale {
    Long id;
    Long customerId;
    LocalDate date;
    String notes;
    Long currencyId;
    BigDecimal exchangeRate;
    BigDecimal totalAmount;
    BigDecimal baseAmount;
    BigDecimal paidAmount;
    BigDecimal additionalCost;
    DiscountType orderDiscountType;
    BigDecimal orderDiscountValue;
    BigDecimal orderDiscountAmount;
    Long discountCodeId;
}
