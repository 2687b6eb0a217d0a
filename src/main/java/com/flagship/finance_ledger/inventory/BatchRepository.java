package com.flagship.finance_ledger.inventory;

import com.flagship.finance_ledger.common.Money;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Batch stock read models. Remaining stock is never stored: it is derived
 * from purchase_items and the sale_items that reference them, so it always
 * reflects the current rows.
 */
@Repository
@RequiredArgsConstructor
public class BatchRepository {

    /** Per-batch purchased and consumed quantity, both in base units. */
    private static final String BATCH_STOCK_CTE =
        "WITH consumed AS ( " +
        "  SELECT si.purchase_item_id, SUM(si.amount * su.ratio) AS consumed_base " +
        "  FROM sale_items si JOIN units su ON su.id = si.unit_id " +
        "  WHERE si.purchase_item_id IS NOT NULL GROUP BY si.purchase_item_id), " +
        "batch_stock AS ( " +
        "  SELECT pi.*, u.ratio AS unit_ratio, u.name AS unit_name, " +
        "         p.batch_number, p.date AS purchase_date, " +
        "         pi.amount * u.ratio AS purchased_base, " +
        "         COALESCE(c.consumed_base, 0) AS consumed_base, " +
        "         pi.amount * u.ratio - COALESCE(c.consumed_base, 0) AS remaining_base " +
        "  FROM purchase_items pi " +
        "  JOIN units u ON u.id = pi.unit_id " +
        "  JOIN purchases p ON p.id = pi.purchase_id " +
        "  LEFT JOIN consumed c ON c.purchase_item_id = pi.id) ";

    private final JdbcTemplate jdbcTemplate;

    public Optional<BatchStock> findStock(long purchaseItemId) {
        return jdbcTemplate.query(
            BATCH_STOCK_CTE +
            "SELECT id, product_id, batch_number, purchased_base, consumed_base FROM batch_stock WHERE id = ?",
            (rs, rowNum) -> BatchStock.builder()
                .purchaseItemId(rs.getLong("id"))
                .productId(rs.getLong("product_id"))
                .batchNumber(rs.getString("batch_number"))
                .purchasedBase(rs.getBigDecimal("purchased_base"))
                .consumedBase(rs.getBigDecimal("consumed_base"))
                .build(),
            purchaseItemId)
            .stream().findFirst();
    }

    /**
     * Locks the batch rows in ascending id order for the rest of the transaction.
     *
     * @return ids that exist
     */
    public List<Long> lockBatches(Collection<Long> purchaseItemIds) {
        if (purchaseItemIds.isEmpty()) {
            return Collections.emptyList();
        }
        String placeholders = purchaseItemIds.stream().map(id -> "?").collect(Collectors.joining(", "));
        return jdbcTemplate.queryForList(
            "SELECT id FROM purchase_items WHERE id IN (" + placeholders + ") ORDER BY id FOR UPDATE",
            Long.class, purchaseItemIds.toArray());
    }

    /**
     * Batches of the product with stock left, oldest purchase first.
     */
    public List<ProductBatch> findOpenBatches(long productId) {
        return jdbcTemplate.query(
            BATCH_STOCK_CTE +
            "SELECT * FROM batch_stock WHERE product_id = ? AND remaining_base > 0 " +
            "ORDER BY purchase_date, expiry_date NULLS LAST, id",
            (rs, rowNum) -> {
                BigDecimal remainingBase = rs.getBigDecimal("remaining_base");
                return ProductBatch.builder()
                    .purchaseItemId(rs.getLong("id"))
                    .purchaseId(rs.getLong("purchase_id"))
                    .batchNumber(rs.getString("batch_number"))
                    .purchaseDate(rs.getObject("purchase_date", LocalDate.class))
                    .expiryDate(rs.getObject("expiry_date", LocalDate.class))
                    .unitId(rs.getLong("unit_id"))
                    .perPrice(rs.getBigDecimal("per_price"))
                    .perUnit(rs.getBigDecimal("per_unit"))
                    .wholesalePrice(rs.getBigDecimal("wholesale_price"))
                    .retailPrice(rs.getBigDecimal("retail_price"))
                    .amount(rs.getBigDecimal("amount"))
                    .remainingQuantity(Money.divide(remainingBase, rs.getBigDecimal("unit_ratio")))
                    .remainingBase(Money.round6(remainingBase))
                    .build();
            },
            productId);
    }

    public BigDecimal totalRemainingBase(long productId) {
        BigDecimal total = jdbcTemplate.queryForObject(
            BATCH_STOCK_CTE +
            "SELECT COALESCE(SUM(GREATEST(remaining_base, 0)), 0) FROM batch_stock WHERE product_id = ?",
            BigDecimal.class, productId);
        return Money.orZero(total);
    }

    /**
     * Every batch with stock left, with product and unit names and price
     * points, for the stock report.
     */
    public List<StockBatchRow> findStockByBatches() {
        return jdbcTemplate.query(
            BATCH_STOCK_CTE +
            "SELECT bs.*, pr.name AS product_name FROM batch_stock bs " +
            "JOIN products pr ON pr.id = bs.product_id " +
            "WHERE bs.remaining_base > 0 ORDER BY pr.name, bs.purchase_date, bs.id",
            (rs, rowNum) -> StockReportCalculator.toRow(
                StockReportCalculator.BatchLine.builder()
                    .productId(rs.getLong("product_id"))
                    .productName(rs.getString("product_name"))
                    .purchaseItemId(rs.getLong("id"))
                    .purchaseId(rs.getLong("purchase_id"))
                    .batchNumber(rs.getString("batch_number"))
                    .purchaseDate(rs.getObject("purchase_date", LocalDate.class))
                    .expiryDate(rs.getObject("expiry_date", LocalDate.class))
                    .unitName(rs.getString("unit_name"))
                    .unitRatio(rs.getBigDecimal("unit_ratio"))
                    .amount(rs.getBigDecimal("amount"))
                    .remainingBase(rs.getBigDecimal("remaining_base"))
                    .perPrice(rs.getBigDecimal("per_price"))
                    .total(rs.getBigDecimal("total"))
                    .costPrice(rs.getBigDecimal("cost_price"))
                    .retailPrice(rs.getBigDecimal("retail_price"))
                    .wholesalePrice(rs.getBigDecimal("wholesale_price"))
                    .build()));
    }

    public long countOpenBatches() {
        Long count = jdbcTemplate.queryForObject(
            BATCH_STOCK_CTE + "SELECT COUNT(*) FROM batch_stock WHERE remaining_base > 0", Long.class);
        return count != null ? count : 0L;
    }

    /**
     * Cost value of all remaining stock, valued at cost price (falling back
     * to the purchase price) per purchase unit.
     */
    public BigDecimal totalStockValue() {
        BigDecimal value = jdbcTemplate.queryForObject(
            BATCH_STOCK_CTE +
            "SELECT COALESCE(SUM(remaining_base / unit_ratio * COALESCE(cost_price, per_price)), 0) " +
            "FROM batch_stock WHERE remaining_base > 0",
            BigDecimal.class);
        return Money.orZero(value);
    }
}
