package com.flagship.finance_ledger.discount;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class DiscountCodeRepository {

    private static final String COLUMNS =
        "SELECT id, code, type, value, min_purchase, valid_from, valid_to, max_uses, use_count " +
        "FROM sale_discount_codes";

    private final JdbcTemplate jdbcTemplate;

    public Optional<DiscountCode> findById(long id) {
        return jdbcTemplate.query(COLUMNS + " WHERE id = ?", rowMapper(), id).stream().findFirst();
    }

    public Optional<DiscountCode> findByCode(String code) {
        return jdbcTemplate.query(COLUMNS + " WHERE code = ?", rowMapper(), code).stream().findFirst();
    }

    public List<DiscountCode> findAll(String search) {
        if (search == null || search.isBlank()) {
            return jdbcTemplate.query(COLUMNS + " ORDER BY created_at DESC, id DESC", rowMapper());
        }
        return jdbcTemplate.query(COLUMNS + " WHERE code ILIKE ? ORDER BY created_at DESC, id DESC",
            rowMapper(), "%" + search.trim() + "%");
    }

    public long insert(DiscountCode code) {
        return jdbcTemplate.queryForObject(
            "INSERT INTO sale_discount_codes (code, type, value, min_purchase, valid_from, valid_to, max_uses) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?) RETURNING id",
            Long.class,
            code.getCode(), code.getType().dbValue(), code.getValue(), code.getMinPurchase(),
            code.getValidFrom(), code.getValidTo(), code.getMaxUses());
    }

    public int update(DiscountCode code) {
        return jdbcTemplate.update(
            "UPDATE sale_discount_codes SET code = ?, type = ?, value = ?, min_purchase = ?, " +
            "valid_from = ?, valid_to = ?, max_uses = ? WHERE id = ?",
            code.getCode(), code.getType().dbValue(), code.getValue(), code.getMinPurchase(),
            code.getValidFrom(), code.getValidTo(), code.getMaxUses(), code.getId());
    }

    public int delete(long id) {
        return jdbcTemplate.update("DELETE FROM sale_discount_codes WHERE id = ?", id);
    }

    /**
     * Consumes one use if any are left. Returns false when the code is exhausted.
     */
    public boolean incrementUseCount(long id) {
        int updated = jdbcTemplate.update(
            "UPDATE sale_discount_codes SET use_count = use_count + 1 " +
            "WHERE id = ? AND (max_uses IS NULL OR use_count < max_uses)",
            id);
        return updated == 1;
    }

    private RowMapper<DiscountCode> rowMapper() {
        return (rs, rowNum) -> DiscountCode.builder()
            .id(rs.getLong("id"))
            .code(rs.getString("code"))
            .type(DiscountType.fromValue(rs.getString("type")))
            .value(rs.getBigDecimal("value"))
            .minPurchase(rs.getBigDecimal("min_purchase"))
            .validFrom(rs.getObject("valid_from", LocalDate.class))
            .validTo(rs.getObject("valid_to", LocalDate.class))
            .maxUses(rs.getObject("max_uses", Integer.class))
            .useCount(rs.getInt("use_count"))
            .build();
    }
}
