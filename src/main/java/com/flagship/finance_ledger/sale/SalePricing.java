package com.flagship.finance_ledger.sale;

import com.flagship.finance_ledger.common.Money;
import com.flagship.finance_ledger.discount.DiscountCalculator;
import com.flagship.finance_ledger.discount.DiscountType;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Collection;

/**
 * Sale arithmetic shared by full create/update and the item-level recompute.
 * Pure; amounts are in the sale's currency.
 */
public final class SalePricing {

    private SalePricing() {
    }

    /**
     * round2(price &times; quantity &minus; line discount).
     */
    public static BigDecimal lineTotal(BigDecimal price, BigDecimal quantity, DiscountType discountType,
                                       BigDecimal discountValue) {
        BigDecimal gross = Money.multiply(price, quantity);
        BigDecimal discount = DiscountCalculator.computeDiscount(gross, discountType, discountValue);
        return Money.round2(gross.subtract(discount));
    }

    public static Totals totals(Collection<BigDecimal> lineTotals, DiscountType orderDiscountType,
                                BigDecimal orderDiscountValue, BigDecimal additionalCost, BigDecimal exchangeRate) {
        BigDecimal subtotal = lineTotals.stream()
            .map(Money::orZero)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        return totals(subtotal, orderDiscountType, orderDiscountValue, additionalCost, exchangeRate);
    }

    public static Totals totals(BigDecimal subtotal, DiscountType orderDiscountType, BigDecimal orderDiscountValue,
                                BigDecimal additionalCost, BigDecimal exchangeRate) {
        BigDecimal orderDiscount = DiscountCalculator.computeDiscount(subtotal, orderDiscountType, orderDiscountValue);
        BigDecimal cost = Money.orZero(additionalCost);
        BigDecimal total = Money.round2(subtotal.subtract(orderDiscount).add(cost));
        BigDecimal base = Money.round6(total.multiply(Money.orOne(exchangeRate)));
        return new Totals(subtotal, orderDiscount, cost, total, base);
    }

    @Value
    public static class Totals {
        BigDecimal subtotal;
        BigDecimal orderDiscountAmount;
        BigDecimal additionalCost;
        BigDecimal totalAmount;
        BigDecimal baseAmount;
    }
}
