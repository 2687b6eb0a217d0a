package com.flagship.finance_ledger.catalog;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * JDBC access to suppliers, customers, products and services.
 */
@Repository
@RequiredArgsConstructor
public class CatalogRepository {

    private static final String PRODUCT_COLUMNS =
        "SELECT id, name, description, price, currency_id, supplier_id, bar_code FROM products";
    private static final String SERVICE_COLUMNS =
        "SELECT id, name, price, currency_id, description FROM services";

    private final JdbcTemplate jdbcTemplate;

    // ==================== Parties ====================

    public Optional<Party> findParty(PartyKind kind, long id) {
        return jdbcTemplate.query(
            "SELECT id, full_name, phone, address, email, notes FROM " + kind.table() + " WHERE id = ?",
            partyRowMapper(), id).stream().findFirst();
    }

    public List<Party> findParties(PartyKind kind, String search) {
        String sql = "SELECT id, full_name, phone, address, email, notes FROM " + kind.table();
        if (search == null || search.isBlank()) {
            return jdbcTemplate.query(sql + " ORDER BY full_name, id", partyRowMapper());
        }
        String pattern = "%" + search.trim() + "%";
        return jdbcTemplate.query(sql + " WHERE full_name ILIKE ? OR phone ILIKE ? ORDER BY full_name, id",
            partyRowMapper(), pattern, pattern);
    }

    public long insertParty(PartyKind kind, Party party) {
        return jdbcTemplate.queryForObject(
            "INSERT INTO " + kind.table() + " (full_name, phone, address, email, notes) " +
            "VALUES (?, ?, ?, ?, ?) RETURNING id",
            Long.class, party.getFullName(), party.getPhone(), party.getAddress(), party.getEmail(), party.getNotes());
    }

    public int updateParty(PartyKind kind, Party party) {
        return jdbcTemplate.update(
            "UPDATE " + kind.table() + " SET full_name = ?, phone = ?, address = ?, email = ?, notes = ?, " +
            "updated_at = CURRENT_TIMESTAMP WHERE id = ?",
            party.getFullName(), party.getPhone(), party.getAddress(), party.getEmail(), party.getNotes(),
            party.getId());
    }

    public int deleteParty(PartyKind kind, long id) {
        return jdbcTemplate.update("DELETE FROM " + kind.table() + " WHERE id = ?", id);
    }

    public long countPartyReferences(PartyKind kind, long id) {
        Long count = jdbcTemplate.queryForObject(kind.referenceCountSql(), Long.class, id);
        long total = count != null ? count : 0L;
        if (kind == PartyKind.SUPPLIER) {
            Long products = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM products WHERE supplier_id = ?", Long.class, id);
            total += products != null ? products : 0L;
        }
        return total;
    }

    // ==================== Products ====================

    public Optional<Product> findProduct(long id) {
        return jdbcTemplate.query(PRODUCT_COLUMNS + " WHERE id = ?", productRowMapper(), id).stream().findFirst();
    }

    public List<Product> findProducts(String search) {
        if (search == null || search.isBlank()) {
            return jdbcTemplate.query(PRODUCT_COLUMNS + " ORDER BY name, id", productRowMapper());
        }
        String pattern = "%" + search.trim() + "%";
        return jdbcTemplate.query(PRODUCT_COLUMNS + " WHERE name ILIKE ? OR bar_code ILIKE ? ORDER BY name, id",
            productRowMapper(), pattern, pattern);
    }

    public long insertProduct(Product product) {
        return jdbcTemplate.queryForObject(
            "INSERT INTO products (name, description, price, currency_id, supplier_id, bar_code) " +
            "VALUES (?, ?, ?, ?, ?, ?) RETURNING id",
            Long.class, product.getName(), product.getDescription(), product.getPrice(), product.getCurrencyId(),
            product.getSupplierId(), product.getBarCode());
    }

    public int updateProduct(Product product) {
        return jdbcTemplate.update(
            "UPDATE products SET name = ?, description = ?, price = ?, currency_id = ?, supplier_id = ?, " +
            "bar_code = ?, updated_at = CURRENT_TIMESTAMP WHERE id = ?",
            product.getName(), product.getDescription(), product.getPrice(), product.getCurrencyId(),
            product.getSupplierId(), product.getBarCode(), product.getId());
    }

    public int deleteProduct(long id) {
        return jdbcTemplate.update("DELETE FROM products WHERE id = ?", id);
    }

    public long countProductReferences(long id) {
        Long count = jdbcTemplate.queryForObject(
            "SELECT (SELECT COUNT(*) FROM purchase_items WHERE product_id = ?) " +
            "     + (SELECT COUNT(*) FROM sale_items WHERE product_id = ?)",
            Long.class, id, id);
        return count != null ? count : 0L;
    }

    // ==================== Services ====================

    public Optional<ServiceOffering> findService(long id) {
        return jdbcTemplate.query(SERVICE_COLUMNS + " WHERE id = ?", serviceRowMapper(), id).stream().findFirst();
    }

    public List<ServiceOffering> findServices() {
        return jdbcTemplate.query(SERVICE_COLUMNS + " ORDER BY name, id", serviceRowMapper());
    }

    public long insertService(ServiceOffering service) {
        return jdbcTemplate.queryForObject(
            "INSERT INTO services (name, price, currency_id, description) VALUES (?, ?, ?, ?) RETURNING id",
            Long.class, service.getName(), service.getPrice(), service.getCurrencyId(), service.getDescription());
    }

    public int updateService(ServiceOffering service) {
        return jdbcTemplate.update(
            "UPDATE services SET name = ?, price = ?, currency_id = ?, description = ?, " +
            "updated_at = CURRENT_TIMESTAMP WHERE id = ?",
            service.getName(), service.getPrice(), service.getCurrencyId(), service.getDescription(),
            service.getId());
    }

    public int deleteService(long id) {
        return jdbcTemplate.update("DELETE FROM services WHERE id = ?", id);
    }

    public long countServiceReferences(long id) {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM sale_service_items WHERE service_id = ?", Long.class, id);
        return count != null ? count : 0L;
    }

    private RowMapper<Party> partyRowMapper() {
        return (rs, rowNum) -> Party.builder()
            .id(rs.getLong("id"))
            .fullName(rs.getString("full_name"))
            .phone(rs.getString("phone"))
            .address(rs.getString("address"))
            .email(rs.getString("email"))
            .notes(rs.getString("notes"))
            .build();
    }

    private RowMapper<Product> productRowMapper() {
        return (rs, rowNum) -> Product.builder()
            .id(rs.getLong("id"))
            .name(rs.getString("name"))
            .description(rs.getString("description"))
            .price(rs.getBigDecimal("price"))
            .currencyId(rs.getObject("currency_id", Long.class))
            .supplierId(rs.getObject("supplier_id", Long.class))
            .barCode(rs.getString("bar_code"))
            .build();
    }

    private RowMapper<ServiceOffering> serviceRowMapper() {
        return (rs, rowNum) -> ServiceOffering.builder()
            .id(rs.getLong("id"))
            .name(rs.getString("name"))
            .price(rs.getBigDecimal("price"))
            .currencyId(rs.getObject("currency_id", Long.class))
            .description(rs.getString("description"))
            .build();
    }
}
