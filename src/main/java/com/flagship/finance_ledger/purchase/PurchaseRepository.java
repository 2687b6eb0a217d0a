package com.flagship.finance_ledger.purchase;

import com.flagship.finance_ledger.common.AdditionalCost;
import com.flagship.finance_ledger.common.PageQuery;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * JDBC access to purchases and their items, additional costs and payments.
 */
@Repository
@RequiredArgsConstructor
public class PurchaseRepository {

    private static final String PURCHASE_COLUMNS =
        "SELECT id, supplier_id, date, notes, currency_id, total_amount, additional_cost, batch_number FROM purchases";
    private static final String ITEM_COLUMNS =
        "SELECT id, purchase_id, product_id, unit_id, per_price, amount, total, per_unit, cost_price, " +
        "wholesale_price, retail_price, expiry_date FROM purchase_items";
    private static final String COST_COLUMNS = "SELECT id, purchase_id, name, amount FROM purchase_additional_costs";
    private static final String PAYMENT_COLUMNS =
        "SELECT id, purchase_id, account_id, amount, currency, rate, total, date, notes FROM purchase_payments";
    private static final Set<String> SORTABLE = Set.of("date", "total_amount", "batch_number", "created_at");

    private final JdbcTemplate jdbcTemplate;

    // ==================== Purchases ====================

    public Optional<Purchase> findById(long id) {
        return jdbcTemplate.query(PURCHASE_COLUMNS + " WHERE id = ?", purchaseRowMapper(), id).stream().findFirst();
    }

    /**
     * Row-locks the purchase header for the rest of the transaction.
     */
    public boolean lock(long id) {
        return !jdbcTemplate.queryForList("SELECT id FROM purchases WHERE id = ? FOR UPDATE", Long.class, id)
            .isEmpty();
    }

    public List<Purchase> findPage(PageQuery query) {
        List<Object> args = new ArrayList<>();
        String where = searchClause(query, args);
        args.add(query.getPerPage());
        args.add(query.offset());
        return jdbcTemplate.query(
            PURCHASE_COLUMNS + where + query.orderBy(SORTABLE, "date") + " LIMIT ? OFFSET ?",
            purchaseRowMapper(), args.toArray());
    }

    public long count(PageQuery query) {
        List<Object> args = new ArrayList<>();
        String where = searchClause(query, args);
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM purchases" + where, Long.class, args.toArray());
        return count != null ? count : 0L;
    }

    public long insert(Purchase purchase) {
        return jdbcTemplate.queryForObject(
            "INSERT INTO purchases (supplier_id, date, notes, currency_id, total_amount, additional_cost, batch_number) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?) RETURNING id",
            Long.class,
            purchase.getSupplierId(), purchase.getDate(), purchase.getNotes(), purchase.getCurrencyId(),
            purchase.getTotalAmount(), purchase.getAdditionalCost(), purchase.getBatchNumber());
    }

    public int updateHeader(Purchase purchase) {
        return jdbcTemplate.update(
            "UPDATE purchases SET supplier_id = ?, date = ?, notes = ?, currency_id = ?, total_amount = ?, " +
            "additional_cost = ?, updated_at = CURRENT_TIMESTAMP WHERE id = ?",
            purchase.getSupplierId(), purchase.getDate(), purchase.getNotes(), purchase.getCurrencyId(),
            purchase.getTotalAmount(), purchase.getAdditionalCost(), purchase.getId());
    }

    /**
     * Re-derives additional_cost from the cost rows and total_amount from the
     * item totals plus that cost.
     */
    public BigDecimal recomputeTotal(long purchaseId) {
        return jdbcTemplate.queryForObject(
            "UPDATE purchases p SET " +
            "  additional_cost = COALESCE((SELECT SUM(amount) FROM purchase_additional_costs " +
            "    WHERE purchase_id = p.id), 0), " +
            "  total_amount = COALESCE((SELECT SUM(total) FROM purchase_items WHERE purchase_id = p.id), 0) " +
            "    + COALESCE((SELECT SUM(amount) FROM purchase_additional_costs WHERE purchase_id = p.id), 0), " +
            "  updated_at = CURRENT_TIMESTAMP " +
            "WHERE p.id = ? RETURNING total_amount",
            BigDecimal.class, purchaseId);
    }

    public int delete(long id) {
        return jdbcTemplate.update("DELETE FROM purchases WHERE id = ?", id);
    }

    // ==================== Items ====================

    public Optional<PurchaseItem> findItem(long id) {
        return jdbcTemplate.query(ITEM_COLUMNS + " WHERE id = ?", itemRowMapper(), id).stream().findFirst();
    }

    public List<PurchaseItem> findItems(long purchaseId) {
        return jdbcTemplate.query(ITEM_COLUMNS + " WHERE purchase_id = ? ORDER BY id", itemRowMapper(), purchaseId);
    }

    public long insertItem(PurchaseItem item) {
        return jdbcTemplate.queryForObject(
            "INSERT INTO purchase_items (purchase_id, product_id, unit_id, per_price, amount, total, per_unit, " +
            "cost_price, wholesale_price, retail_price, expiry_date) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?) " +
            "RETURNING id",
            Long.class,
            item.getPurchaseId(), item.getProductId(), item.getUnitId(), item.getPerPrice(), item.getAmount(),
            item.getTotal(), item.getPerUnit(), item.getCostPrice(), item.getWholesalePrice(), item.getRetailPrice(),
            item.getExpiryDate());
    }

    public int updateItem(PurchaseItem item) {
        return jdbcTemplate.update(
            "UPDATE purchase_items SET product_id = ?, unit_id = ?, per_price = ?, amount = ?, total = ?, " +
            "per_unit = ?, cost_price = ?, wholesale_price = ?, retail_price = ?, expiry_date = ? WHERE id = ?",
            item.getProductId(), item.getUnitId(), item.getPerPrice(), item.getAmount(), item.getTotal(),
            item.getPerUnit(), item.getCostPrice(), item.getWholesalePrice(), item.getRetailPrice(),
            item.getExpiryDate(), item.getId());
    }

    public int deleteItem(long id) {
        return jdbcTemplate.update("DELETE FROM purchase_items WHERE id = ?", id);
    }

    public long countSaleItemsReferencing(long purchaseItemId) {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM sale_items WHERE purchase_item_id = ?", Long.class, purchaseItemId);
        return count != null ? count : 0L;
    }

    public long countSoldItems(long purchaseId) {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM sale_items si JOIN purchase_items pi ON pi.id = si.purchase_item_id " +
            "WHERE pi.purchase_id = ?", Long.class, purchaseId);
        return count != null ? count : 0L;
    }

    // ==================== Additional costs ====================

    public Optional<AdditionalCost> findAdditionalCost(long id) {
        return jdbcTemplate.query(COST_COLUMNS + " WHERE id = ?", costRowMapper(), id).stream().findFirst();
    }

    public List<AdditionalCost> findAdditionalCosts(long purchaseId) {
        return jdbcTemplate.query(COST_COLUMNS + " WHERE purchase_id = ? ORDER BY id", costRowMapper(), purchaseId);
    }

    public long insertAdditionalCost(long purchaseId, String name, BigDecimal amount) {
        return jdbcTemplate.queryForObject(
            "INSERT INTO purchase_additional_costs (purchase_id, name, amount) VALUES (?, ?, ?) RETURNING id",
            Long.class, purchaseId, name, amount);
    }

    public int updateAdditionalCost(long id, String name, BigDecimal amount) {
        return jdbcTemplate.update("UPDATE purchase_additional_costs SET name = ?, amount = ? WHERE id = ?",
            name, amount, id);
    }

    public int deleteAdditionalCost(long id) {
        return jdbcTemplate.update("DELETE FROM purchase_additional_costs WHERE id = ?", id);
    }

    public void deleteAdditionalCosts(long purchaseId) {
        jdbcTemplate.update("DELETE FROM purchase_additional_costs WHERE purchase_id = ?", purchaseId);
    }

    // ==================== Payments ====================

    public Optional<PurchasePayment> findPayment(long id) {
        return jdbcTemplate.query(PAYMENT_COLUMNS + " WHERE id = ?", paymentRowMapper(), id).stream().findFirst();
    }

    public List<PurchasePayment> findPayments(long purchaseId) {
        return jdbcTemplate.query(PAYMENT_COLUMNS + " WHERE purchase_id = ? ORDER BY date, id",
            paymentRowMapper(), purchaseId);
    }

    public long insertPayment(PurchasePayment payment) {
        return jdbcTemplate.queryForObject(
            "INSERT INTO purchase_payments (purchase_id, account_id, amount, currency, rate, total, date, notes) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?) RETURNING id",
            Long.class,
            payment.getPurchaseId(), payment.getAccountId(), payment.getAmount(), payment.getCurrency(),
            payment.getRate(), payment.getTotal(), payment.getDate(), payment.getNotes());
    }

    public int updatePayment(PurchasePayment payment) {
        return jdbcTemplate.update(
            "UPDATE purchase_payments SET account_id = ?, amount = ?, currency = ?, rate = ?, total = ?, " +
            "date = ?, notes = ? WHERE id = ?",
            payment.getAccountId(), payment.getAmount(), payment.getCurrency(), payment.getRate(),
            payment.getTotal(), payment.getDate(), payment.getNotes(), payment.getId());
    }

    public int deletePayment(long id) {
        return jdbcTemplate.update("DELETE FROM purchase_payments WHERE id = ?", id);
    }

    private String searchClause(PageQuery query, List<Object> args) {
        if (!query.hasSearch()) {
            return "";
        }
        args.add(query.searchPattern());
        args.add(query.searchPattern());
        return " WHERE LOWER(COALESCE(batch_number, '')) LIKE ? OR LOWER(COALESCE(notes, '')) LIKE ?";
    }

    private RowMapper<Purchase> purchaseRowMapper() {
        return (rs, rowNum) -> Purchase.builder()
            .id(rs.getLong("id"))
            .supplierId(rs.getLong("supplier_id"))
            .date(rs.getObject("date", LocalDate.class))
            .notes(rs.getString("notes"))
            .currencyId(rs.getObject("currency_id", Long.class))
            .totalAmount(rs.getBigDecimal("total_amount"))
            .additionalCost(rs.getBigDecimal("additional_cost"))
            .batchNumber(rs.getString("batch_number"))
            .build();
    }

    private RowMapper<PurchaseItem> itemRowMapper() {
        return (rs, rowNum) -> PurchaseItem.builder()
            .id(rs.getLong("id"))
            .purchaseId(rs.getLong("purchase_id"))
            .productId(rs.getLong("product_id"))
            .unitId(rs.getLong("unit_id"))
            .perPrice(rs.getBigDecimal("per_price"))
            .amount(rs.getBigDecimal("amount"))
            .total(rs.getBigDecimal("total"))
            .perUnit(rs.getBigDecimal("per_unit"))
            .costPrice(rs.getBigDecimal("cost_price"))
            .wholesalePrice(rs.getBigDecimal("wholesale_price"))
            .retailPrice(rs.getBigDecimal("retail_price"))
            .expiryDate(rs.getObject("expiry_date", LocalDate.class))
            .build();
    }

    private RowMapper<AdditionalCost> costRowMapper() {
        return (rs, rowNum) -> new AdditionalCost(rs.getLong("id"), rs.getLong("purchase_id"),
            rs.getString("name"), rs.getBigDecimal("amount"));
    }

    private RowMapper<PurchasePayment> paymentRowMapper() {
        return (rs, rowNum) -> PurchasePayment.builder()
            .id(rs.getLong("id"))
            .purchaseId(rs.getLong("purchase_id"))
            .accountId(rs.getObject("account_id", Long.class))
            .amount(rs.getBigDecimal("amount"))
            .currency(rs.getString("currency"))
            .rate(rs.getBigDecimal("rate"))
            .total(rs.getBigDecimal("total"))
            .date(rs.getObject("date", LocalDate.class))
            .notes(rs.getString("notes"))
            .build();
    }
}
