package com.flagship.finance_ledger.sale;

import com.flagship.finance_ledger.common.AdditionalCost;
import com.flagship.finance_ledger.common.PageQuery;
import com.flagship.finance_ledger.discount.DiscountType;
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
 * JDBC access to sales and their items, service items, additional costs and
 * payments.
 */
@Repository
@RequiredArgsConstructor
public class SaleRepository {

    private static final String SALE_COLUMNS =
        "SELECT id, customer_id, date, notes, currency_id, exchange_rate, total_amount, base_amount, paid_amount, " +
        "additional_cost, order_discount_type, order_discount_value, order_discount_amount, discount_code_id " +
        "FROM sales";
    private static final String ITEM_COLUMNS =
        "SELECT id, sale_id, product_id, unit_id, per_price, amount, total, purchase_item_id, sale_type, " +
        "discount_type, discount_value FROM sale_items";
    private static final String SERVICE_ITEM_COLUMNS =
        "SELECT id, sale_id, service_id, name, price, quantity, total, discount_type, discount_value " +
        "FROM sale_service_items";
    private static final String COST_COLUMNS = "SELECT id, sale_id, name, amount FROM sale_additional_costs";
    private static final String PAYMENT_COLUMNS =
        "SELECT id, sale_id, account_id, currency_id, exchange_rate, amount, base_amount, date FROM sale_payments";
    private static final Set<String> SORTABLE = Set.of("date", "total_amount", "paid_amount", "created_at");

    private final JdbcTemplate jdbcTemplate;

    // ==================== Sales ====================

    public Optional<Sale> findById(long id) {
        return jdbcTemplate.query(SALE_COLUMNS + " WHERE id = ?", saleRowMapper(), id).stream().findFirst();
    }

    /**
     * Row-locks the sale header for the rest of the transaction.
     */
    public boolean lock(long id) {
        return !jdbcTemplate.queryForList("SELECT id FROM sales WHERE id = ? FOR UPDATE", Long.class, id).isEmpty();
    }

    public List<Sale> findPage(PageQuery query) {
        List<Object> args = new ArrayList<>();
        String where = searchClause(query, args);
        args.add(query.getPerPage());
        args.add(query.offset());
        return jdbcTemplate.query(
            SALE_COLUMNS + where + query.orderBy(SORTABLE, "date") + " LIMIT ? OFFSET ?",
            saleRowMapper(), args.toArray());
    }

    public long count(PageQuery query) {
        List<Object> args = new ArrayList<>();
        String where = searchClause(query, args);
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM sales" + where, Long.class, args.toArray());
        return count != null ? count : 0L;
    }

    public long insert(Sale sale) {
        return jdbcTemplate.queryForObject(
            "INSERT INTO sales (customer_id, date, notes, currency_id, exchange_rate, total_amount, base_amount, " +
            "paid_amount, additional_cost, order_discount_type, order_discount_value, order_discount_amount, " +
            "discount_code_id) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?) RETURNING id",
            Long.class,
            sale.getCustomerId(), sale.getDate(), sale.getNotes(), sale.getCurrencyId(), sale.getExchangeRate(),
            sale.getTotalAmount(), sale.getBaseAmount(), sale.getPaidAmount(), sale.getAdditionalCost(),
            DiscountType.toDbValue(sale.getOrderDiscountType()), sale.getOrderDiscountValue(),
            sale.getOrderDiscountAmount(), sale.getDiscountCodeId());
    }

    /**
     * Rewrites the header and totals; paid_amount is owned by the payments.
     */
    public int updateHeader(Sale sale) {
        return jdbcTemplate.update(
            "UPDATE sales SET customer_id = ?, date = ?, notes = ?, currency_id = ?, exchange_rate = ?, " +
            "total_amount = ?, base_amount = ?, additional_cost = ?, order_discount_type = ?, " +
            "order_discount_value = ?, order_discount_amount = ?, discount_code_id = ?, " +
            "updated_at = CURRENT_TIMESTAMP WHERE id = ?",
            sale.getCustomerId(), sale.getDate(), sale.getNotes(), sale.getCurrencyId(), sale.getExchangeRate(),
            sale.getTotalAmount(), sale.getBaseAmount(), sale.getAdditionalCost(),
            DiscountType.toDbValue(sale.getOrderDiscountType()), sale.getOrderDiscountValue(),
            sale.getOrderDiscountAmount(), sale.getDiscountCodeId(), sale.getId());
    }

    public int updateTotals(long saleId, SalePricing.Totals totals) {
        return jdbcTemplate.update(
            "UPDATE sales SET order_discount_amount = ?, additional_cost = ?, total_amount = ?, base_amount = ?, " +
            "updated_at = CURRENT_TIMESTAMP WHERE id = ?",
            totals.getOrderDiscountAmount(), totals.getAdditionalCost(), totals.getTotalAmount(),
            totals.getBaseAmount(), saleId);
    }

    /**
     * Sets paid_amount to the sum of the stored payments and returns it.
     */
    public BigDecimal recomputePaidAmount(long saleId) {
        return jdbcTemplate.queryForObject(
            "UPDATE sales s SET paid_amount = " +
            "  COALESCE((SELECT SUM(amount) FROM sale_payments WHERE sale_id = s.id), 0), " +
            "  updated_at = CURRENT_TIMESTAMP " +
            "WHERE s.id = ? RETURNING paid_amount",
            BigDecimal.class, saleId);
    }

    /**
     * &Sigma; product line totals + &Sigma; service line totals.
     */
    public BigDecimal sumLineTotals(long saleId) {
        return jdbcTemplate.queryForObject(
            "SELECT COALESCE((SELECT SUM(total) FROM sale_items WHERE sale_id = ?), 0) + " +
            "COALESCE((SELECT SUM(total) FROM sale_service_items WHERE sale_id = ?), 0)",
            BigDecimal.class, saleId, saleId);
    }

    public long countLines(long saleId) {
        Long count = jdbcTemplate.queryForObject(
            "SELECT (SELECT COUNT(*) FROM sale_items WHERE sale_id = ?) + " +
            "(SELECT COUNT(*) FROM sale_service_items WHERE sale_id = ?)",
            Long.class, saleId, saleId);
        return count != null ? count : 0L;
    }

    public BigDecimal sumAdditionalCosts(long saleId) {
        return jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(amount), 0) FROM sale_additional_costs WHERE sale_id = ?",
            BigDecimal.class, saleId);
    }

    public int delete(long id) {
        return jdbcTemplate.update("DELETE FROM sales WHERE id = ?", id);
    }

    // ==================== Items ====================

    public Optional<SaleItem> findItem(long id) {
        return jdbcTemplate.query(ITEM_COLUMNS + " WHERE id = ?", itemRowMapper(), id).stream().findFirst();
    }

    public List<SaleItem> findItems(long saleId) {
        return jdbcTemplate.query(ITEM_COLUMNS + " WHERE sale_id = ? ORDER BY id", itemRowMapper(), saleId);
    }

    public long insertItem(SaleItem item) {
        return jdbcTemplate.queryForObject(
            "INSERT INTO sale_items (sale_id, product_id, unit_id, per_price, amount, total, purchase_item_id, " +
            "sale_type, discount_type, discount_value) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?) RETURNING id",
            Long.class,
            item.getSaleId(), item.getProductId(), item.getUnitId(), item.getPerPrice(), item.getAmount(),
            item.getTotal(), item.getPurchaseItemId(), item.getSaleType(),
            DiscountType.toDbValue(item.getDiscountType()), item.getDiscountValue());
    }

    public int updateItem(SaleItem item) {
        return jdbcTemplate.update(
            "UPDATE sale_items SET product_id = ?, unit_id = ?, per_price = ?, amount = ?, total = ?, " +
            "purchase_item_id = ?, sale_type = ?, discount_type = ?, discount_value = ? WHERE id = ?",
            item.getProductId(), item.getUnitId(), item.getPerPrice(), item.getAmount(), item.getTotal(),
            item.getPurchaseItemId(), item.getSaleType(), DiscountType.toDbValue(item.getDiscountType()),
            item.getDiscountValue(), item.getId());
    }

    public int deleteItem(long id) {
        return jdbcTemplate.update("DELETE FROM sale_items WHERE id = ?", id);
    }

    public int deleteItems(long saleId) {
        return jdbcTemplate.update("DELETE FROM sale_items WHERE sale_id = ?", saleId);
    }

    // ==================== Service items ====================

    public Optional<SaleServiceItem> findServiceItem(long id) {
        return jdbcTemplate.query(SERVICE_ITEM_COLUMNS + " WHERE id = ?", serviceItemRowMapper(), id)
            .stream().findFirst();
    }

    public List<SaleServiceItem> findServiceItems(long saleId) {
        return jdbcTemplate.query(SERVICE_ITEM_COLUMNS + " WHERE sale_id = ? ORDER BY id",
            serviceItemRowMapper(), saleId);
    }

    public long insertServiceItem(SaleServiceItem item) {
        return jdbcTemplate.queryForObject(
            "INSERT INTO sale_service_items (sale_id, service_id, name, price, quantity, total, discount_type, " +
            "discount_value) VALUES (?, ?, ?, ?, ?, ?, ?, ?) RETURNING id",
            Long.class,
            item.getSaleId(), item.getServiceId(), item.getName(), item.getPrice(), item.getQuantity(),
            item.getTotal(), DiscountType.toDbValue(item.getDiscountType()), item.getDiscountValue());
    }

    public int updateServiceItem(SaleServiceItem item) {
        return jdbcTemplate.update(
            "UPDATE sale_service_items SET service_id = ?, name = ?, price = ?, quantity = ?, total = ?, " +
            "discount_type = ?, discount_value = ? WHERE id = ?",
            item.getServiceId(), item.getName(), item.getPrice(), item.getQuantity(), item.getTotal(),
            DiscountType.toDbValue(item.getDiscountType()), item.getDiscountValue(), item.getId());
    }

    public int deleteServiceItem(long id) {
        return jdbcTemplate.update("DELETE FROM sale_service_items WHERE id = ?", id);
    }

    public int deleteServiceItems(long saleId) {
        return jdbcTemplate.update("DELETE FROM sale_service_items WHERE sale_id = ?", saleId);
    }

    // ==================== Additional costs ====================

    public Optional<AdditionalCost> findAdditionalCost(long id) {
        return jdbcTemplate.query(COST_COLUMNS + " WHERE id = ?", costRowMapper(), id).stream().findFirst();
    }

    public List<AdditionalCost> findAdditionalCosts(long saleId) {
        return jdbcTemplate.query(COST_COLUMNS + " WHERE sale_id = ? ORDER BY id", costRowMapper(), saleId);
    }

    public long insertAdditionalCost(long saleId, String name, BigDecimal amount) {
        return jdbcTemplate.queryForObject(
            "INSERT INTO sale_additional_costs (sale_id, name, amount) VALUES (?, ?, ?) RETURNING id",
            Long.class, saleId, name, amount);
    }

    public int updateAdditionalCost(long id, String name, BigDecimal amount) {
        return jdbcTemplate.update("UPDATE sale_additional_costs SET name = ?, amount = ? WHERE id = ?",
            name, amount, id);
    }

    public int deleteAdditionalCost(long id) {
        return jdbcTemplate.update("DELETE FROM sale_additional_costs WHERE id = ?", id);
    }

    public int deleteAdditionalCosts(long saleId) {
        return jdbcTemplate.update("DELETE FROM sale_additional_costs WHERE sale_id = ?", saleId);
    }

    // ==================== Payments ====================

    public Optional<SalePayment> findPayment(long id) {
        return jdbcTemplate.query(PAYMENT_COLUMNS + " WHERE id = ?", paymentRowMapper(), id).stream().findFirst();
    }

    public List<SalePayment> findPayments(long saleId) {
        return jdbcTemplate.query(PAYMENT_COLUMNS + " WHERE sale_id = ? ORDER BY date, id",
            paymentRowMapper(), saleId);
    }

    public long insertPayment(SalePayment payment) {
        return jdbcTemplate.queryForObject(
            "INSERT INTO sale_payments (sale_id, account_id, currency_id, exchange_rate, amount, base_amount, date) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?) RETURNING id",
            Long.class,
            payment.getSaleId(), payment.getAccountId(), payment.getCurrencyId(), payment.getExchangeRate(),
            payment.getAmount(), payment.getBaseAmount(), payment.getDate());
    }

    public int deletePayment(long id) {
        return jdbcTemplate.update("DELETE FROM sale_payments WHERE id = ?", id);
    }

    private String searchClause(PageQuery query, List<Object> args) {
        if (!query.hasSearch()) {
            return "";
        }
        args.add(query.searchPattern());
        args.add(query.searchPattern());
        return " WHERE LOWER(COALESCE(notes, '')) LIKE ? " +
            "OR customer_id IN (SELECT id FROM customers WHERE LOWER(full_name) LIKE ?)";
    }

    private RowMapper<Sale> saleRowMapper() {
        return (rs, rowNum) -> Sale.builder()
            .id(rs.getLong("id"))
            .customerId(rs.getLong("customer_id"))
            .date(rs.getObject("date", LocalDate.class))
            .notes(rs.getString("notes"))
            .currencyId(rs.getObject("currency_id", Long.class))
            .exchangeRate(rs.getBigDecimal("exchange_rate"))
            .totalAmount(rs.getBigDecimal("total_amount"))
            .baseAmount(rs.getBigDecimal("base_amount"))
            .paidAmount(rs.getBigDecimal("paid_amount"))
            .additionalCost(rs.getBigDecimal("additional_cost"))
            .orderDiscountType(DiscountType.fromValue(rs.getString("order_discount_type")))
            .orderDiscountValue(rs.getBigDecimal("order_discount_value"))
            .orderDiscountAmount(rs.getBigDecimal("order_discount_amount"))
            .discountCodeId(rs.getObject("discount_code_id", Long.class))
            .build();
    }

    private RowMapper<SaleItem> itemRowMapper() {
        return (rs, rowNum) -> SaleItem.builder()
            .id(rs.getLong("id"))
            .saleId(rs.getLong("sale_id"))
            .productId(rs.getLong("product_id"))
            .unitId(rs.getLong("unit_id"))
            .perPrice(rs.getBigDecimal("per_price"))
            .amount(rs.getBigDecimal("amount"))
            .total(rs.getBigDecimal("total"))
            .purchaseItemId(rs.getObject("purchase_item_id", Long.class))
            .saleType(rs.getString("sale_type"))
            .discountType(DiscountType.fromValue(rs.getString("discount_type")))
            .discountValue(rs.getBigDecimal("discount_value"))
            .build();
    }

    private RowMapper<SaleServiceItem> serviceItemRowMapper() {
        return (rs, rowNum) -> SaleServiceItem.builder()
            .id(rs.getLong("id"))
            .saleId(rs.getLong("sale_id"))
            .serviceId(rs.getLong("service_id"))
            .name(rs.getString("name"))
            .price(rs.getBigDecimal("price"))
            .quantity(rs.getBigDecimal("quantity"))
            .total(rs.getBigDecimal("total"))
            .discountType(DiscountType.fromValue(rs.getString("discount_type")))
            .discountValue(rs.getBigDecimal("discount_value"))
            .build();
    }

    private RowMapper<AdditionalCost> costRowMapper() {
        return (rs, rowNum) -> new AdditionalCost(rs.getLong("id"), rs.getLong("sale_id"),
            rs.getString("name"), rs.getBigDecimal("amount"));
    }

    private RowMapper<SalePayment> paymentRowMapper() {
        return (rs, rowNum) -> SalePayment.builder()
            .id(rs.getLong("id"))
            .saleId(rs.getLong("sale_id"))
            .accountId(rs.getObject("account_id", Long.class))
            .currencyId(rs.getObject("currency_id", Long.class))
            .exchangeRate(rs.getBigDecimal("exchange_rate"))
            .amount(rs.getBigDecimal("amount"))
            .baseAmount(rs.getBigDecimal("base_amount"))
            .date(rs.getObject("date", LocalDate.class))
            .build();
    }
}
