package com.flagship.finance_ledger.inventory;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One line of the stock-by-batch report. Quantities are in the batch's
 * purchase unit so they line up with the per-unit prices.
 */
@Value
@Builder
public class StockBatchRow {
    Long productId;
    String productName;
    Long purchaseItemId;
    Long purchaseId;
    String batchNumber;
    LocalDate purchaseDate;
    LocalDate expiryDate;
    String unitName;
    BigDecimal amount;
    BigDecimal remainingQuantity;
    BigDecimal perPrice;
    BigDecimal totalPurchaseCost;
    BigDecimal costPrice;
    BigDecimal retailPrice;
    BigDecimal wholesalePrice;
    BigDecimal stockValue;
    BigDecimal potentialRevenueRetail;
    BigDecimal potentialProfit;
    BigDecimal marginPercent;
}
