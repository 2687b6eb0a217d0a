package com.flagship.finance_ledger.coa;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class CoaCategoryRepository {

    private static final String COLUMNS =
        "SELECT id, parent_id, name, code, category_type, level FROM coa_categories";

    private final JdbcTemplate jdbcTemplate;

    public Optional<CoaCategory> findById(long id) {
        return jdbcTemplate.query(COLUMNS + " WHERE id = ?", rowMapper(), id).stream().findFirst();
    }

    public Optional<CoaCategory> findByCode(String code) {
        return jdbcTemplate.query(COLUMNS + " WHERE code = ?", rowMapper(), code).stream().findFirst();
    }

    public List<CoaCategory> findAll() {
        return jdbcTemplate.query(COLUMNS + " ORDER BY code, id", rowMapper());
    }

    public long insert(CoaCategory category) {
        return jdbcTemplate.queryForObject(
            "INSERT INTO coa_categories (parent_id, name, code, category_type, level) VALUES (?, ?, ?, ?, ?) " +
            "RETURNING id",
            Long.class,
            category.getParentId(), category.getName(), category.getCode(), category.getCategoryType(),
            category.getLevel());
    }

    public int update(CoaCategory category) {
        return jdbcTemplate.update(
            "UPDATE coa_categories SET parent_id = ?, name = ?, code = ?, category_type = ?, level = ?, " +
            "updated_at = CURRENT_TIMESTAMP WHERE id = ?",
            category.getParentId(), category.getName(), category.getCode(), category.getCategoryType(),
            category.getLevel(), category.getId());
    }

    /**
     * Re-derives the level of every descendant of {@code id} from its own.
     */
    public int relevelDescendants(long id) {
        return jdbcTemplate.update(
            "WITH RECURSIVE tree AS (" +
            "  SELECT id, level FROM coa_categories WHERE id = ? " +
            "  UNION ALL " +
            "  SELECT c.id, t.level + 1 FROM coa_categories c JOIN tree t ON c.parent_id = t.id" +
            ") UPDATE coa_categories SET level = tree.level FROM tree " +
            "WHERE coa_categories.id = tree.id AND coa_categories.level <> tree.level",
            id);
    }

    /**
     * Ids from {@code id} up to its root, starting with {@code id} itself.
     */
    public List<Long> findAncestry(long id) {
        return jdbcTemplate.queryForList(
            "WITH RECURSIVE up AS (" +
            "  SELECT id, parent_id, 0 AS depth FROM coa_categories WHERE id = ? " +
            "  UNION ALL " +
            "  SELECT c.id, c.parent_id, u.depth + 1 FROM coa_categories c JOIN up u ON c.id = u.parent_id " +
            "  WHERE u.depth < 64" +
            ") SELECT id FROM up ORDER BY depth",
            Long.class, id);
    }

    public int delete(long id) {
        return jdbcTemplate.update("DELETE FROM coa_categories WHERE id = ?", id);
    }

    public long countChildren(long id) {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM coa_categories WHERE parent_id = ?", Long.class, id);
        return count != null ? count : 0L;
    }

    public long countAccounts(long id) {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM accounts WHERE coa_category_id = ?", Long.class, id);
        return count != null ? count : 0L;
    }

    private RowMapper<CoaCategory> rowMapper() {
        return (rs, rowNum) -> CoaCategory.builder()
            .id(rs.getLong("id"))
            .parentId(rs.getObject("parent_id", Long.class))
            .name(rs.getString("name"))
            .code(rs.getString("code"))
            .categoryType(rs.getString("category_type"))
            .level(rs.getInt("level"))
            .build();
    }
}
