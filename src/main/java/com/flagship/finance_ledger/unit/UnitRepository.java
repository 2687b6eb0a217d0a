package com.flagship.finance_ledger.unit;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class UnitRepository {

    private static final String UNIT_COLUMNS = "SELECT id, name, group_id, ratio, is_base FROM units";

    private final JdbcTemplate jdbcTemplate;

    public Optional<Unit> findById(long id) {
        return jdbcTemplate.query(UNIT_COLUMNS + " WHERE id = ?", unitRowMapper(), id)
            .stream().findFirst();
    }

    public List<Unit> findAll() {
        return jdbcTemplate.query(UNIT_COLUMNS + " ORDER BY group_id NULLS LAST, ratio, name", unitRowMapper());
    }

    public long insert(String name, Long groupId, BigDecimal ratio, boolean base) {
        return jdbcTemplate.queryForObject(
            "INSERT INTO units (name, group_id, ratio, is_base) VALUES (?, ?, ?, ?) RETURNING id",
            Long.class, name, groupId, ratio, base);
    }

    public int update(long id, String name, Long groupId, BigDecimal ratio, boolean base) {
        return jdbcTemplate.update(
            "UPDATE units SET name = ?, group_id = ?, ratio = ?, is_base = ?, updated_at = CURRENT_TIMESTAMP " +
            "WHERE id = ?",
            name, groupId, ratio, base, id);
    }

    /**
     * Clears the base flag on the other units of the same group.
     */
    public void clearGroupBaseExcept(long groupId, long keepId) {
        jdbcTemplate.update(
            "UPDATE units SET is_base = FALSE, updated_at = CURRENT_TIMESTAMP " +
            "WHERE group_id = ? AND id <> ? AND is_base",
            groupId, keepId);
    }

    public int delete(long id) {
        return jdbcTemplate.update("DELETE FROM units WHERE id = ?", id);
    }

    public long countItemReferences(long id) {
        Long count = jdbcTemplate.queryForObject(
            "SELECT (SELECT COUNT(*) FROM purchase_items WHERE unit_id = ?) " +
            "     + (SELECT COUNT(*) FROM sale_items WHERE unit_id = ?)",
            Long.class, id, id);
        return count != null ? count : 0L;
    }

    public List<UnitGroup> findAllGroups() {
        return jdbcTemplate.query("SELECT id, name FROM unit_groups ORDER BY name",
            (rs, rowNum) -> new UnitGroup(rs.getLong("id"), rs.getString("name")));
    }

    public long insertGroup(String name) {
        return jdbcTemplate.queryForObject(
            "INSERT INTO unit_groups (name) VALUES (?) RETURNING id", Long.class, name);
    }

    public boolean groupExists(long id) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM unit_groups WHERE id = ?", Integer.class, id);
        return count != null && count > 0;
    }

    private RowMapper<Unit> unitRowMapper() {
        return (rs, rowNum) -> Unit.builder()
            .id(rs.getLong("id"))
            .name(rs.getString("name"))
            .groupId(rs.getObject("group_id", Long.class))
            .ratio(rs.getBigDecimal("ratio"))
            .base(rs.getBoolean("is_base"))
            .build();
    }
}
