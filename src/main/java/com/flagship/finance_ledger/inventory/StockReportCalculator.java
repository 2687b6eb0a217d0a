package com.flagship.finance_ledger.inventory;

import com.flagship.finance_ledger.common.Money;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;

/**
 * Derives the valuation columns of the stock report from a batch's raw
 * figures. Missing cost price falls back to the purchase price; missing
 * retail price means no revenue or margin.
 */
final class StockReportCalculator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private StockReportCalculator() {
    }

    static StockBatchRow toRow(BatchLine line) {
        BigDecimal remaining = Money.divide(line.getRemainingBase(), line.getUnitRatio());
        BigDecimal cost = line.getCostPrice() != null ? line.getCostPrice() : line.getPerPrice();
        BigDecimal stockValue = Money.round2(remaining.multiply(cost));

        BigDecimal revenue = BigDecimal.ZERO;
        BigDecimal profit = BigDecimal.ZERO;
        BigDecimal margin = BigDecimal.ZERO;
        if (line.getRetailPrice() != null) {
            revenue = Money.round2(remaining.multiply(line.getRetailPrice()));
            profit = revenue.subtract(stockValue);
            if (line.getRetailPrice().signum() > 0) {
                margin = line.getRetailPrice().subtract(cost)
                    .multiply(HUNDRED)
                    .divide(line.getRetailPrice(), 2, RoundingMode.HALF_UP);
            }
        }

        return StockBatchRow.builder()
            .productId(line.getProductId())
            .productName(line.getProductName())
            .purchaseItemId(line.getPurchaseItemId())
            .purchaseId(line.getPurchaseId())
            .batchNumber(line.getBatchNumber())
            .purchaseDate(line.getPurchaseDate())
            .expiryDate(line.getExpiryDate())
            .unitName(line.getUnitName())
            .amount(line.getAmount())
            .remainingQuantity(remaining)
            .perPrice(line.getPerPrice())
            .totalPurchaseCost(line.getTotal())
            .costPrice(cost)
            .retailPrice(line.getRetailPrice())
            .wholesalePrice(line.getWholesalePrice())
            .stockValue(stockValue)
            .potentialRevenueRetail(revenue)
            .potentialProfit(profit)
            .marginPercent(margin)
            .build();
    }

    @Value
    @Builder
    static class BatchLine {
        Long productId;
        String productName;
        Long purchaseItemId;
        Long purchaseId;
        String batchNumber;
        LocalDate purchaseDate;
        LocalDate expiryDate;
        String unitName;
        BigDecimal unitRatio;
        BigDecimal amount;
        BigDecimal remainingBase;
        BigDecimal perPrice;
        BigDecimal total;
        BigDecimal costPrice;
        BigDecimal retailPrice;
        BigDecimal wholesalePrice;
    }
}
