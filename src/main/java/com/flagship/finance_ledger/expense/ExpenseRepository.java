package com.flagship.finance_ledger.expense;

import com.flagship.finance_ledger.common.PageQuery;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@Repository
@RequiredArgsConstructor
public class ExpenseRepository {

    private static final String EXPENSE_COLUMNS =
        "SELECT id, expense_type_id, account_id, amount, currency, rate, total, date, bill_no, description " +
        "FROM expenses";
    private static final Set<String> SORTABLE = Set.of("date", "amount", "total", "created_at");

    private final JdbcTemplate jdbcTemplate;

    // ==================== Expense types ====================

    public Optional<ExpenseType> findType(long id) {
        return jdbcTemplate.query("SELECT id, name FROM expense_types WHERE id = ?",
            (rs, rowNum) -> new ExpenseType(rs.getLong("id"), rs.getString("name")), id).stream().findFirst();
    }

    public List<ExpenseType> findAllTypes() {
        return jdbcTemplate.query("SELECT id, name FROM expense_types ORDER BY name",
            (rs, rowNum) -> new ExpenseType(rs.getLong("id"), rs.getString("name")));
    }

    public long insertType(String name) {
        return jdbcTemplate.queryForObject(
            "INSERT INTO expense_types (name) VALUES (?) RETURNING id", Long.class, name);
    }

    public int updateType(long id, String name) {
        return jdbcTemplate.update(
            "UPDATE expense_types SET name = ?, updated_at = CURRENT_TIMESTAMP WHERE id = ?", name, id);
    }

    public int deleteType(long id) {
        return jdbcTemplate.update("DELETE FROM expense_types WHERE id = ?", id);
    }

    public long countExpensesOfType(long typeId) {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM expenses WHERE expense_type_id = ?", Long.class, typeId);
        return count != null ? count : 0L;
    }

    // ==================== Expenses ====================

    public Optional<Expense> findById(long id) {
        return jdbcTemplate.query(EXPENSE_COLUMNS + " WHERE id = ?", expenseRowMapper(), id).stream().findFirst();
    }

    public List<Expense> findPage(PageQuery query) {
        List<Object> args = new ArrayList<>();
        String where = searchClause(query, args);
        args.add(query.getPerPage());
        args.add(query.offset());
        return jdbcTemplate.query(
            EXPENSE_COLUMNS + where + query.orderBy(SORTABLE, "date") + " LIMIT ? OFFSET ?",
            expenseRowMapper(), args.toArray());
    }

    public long count(PageQuery query) {
        List<Object> args = new ArrayList<>();
        String where = searchClause(query, args);
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM expenses" + where, Long.class, args.toArray());
        return count != null ? count : 0L;
    }

    public long insert(Expense expense) {
        return jdbcTemplate.queryForObject(
            "INSERT INTO expenses (expense_type_id, account_id, amount, currency, rate, total, date, bill_no, " +
            "description) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?) RETURNING id",
            Long.class,
            expense.getExpenseTypeId(), expense.getAccountId(), expense.getAmount(), expense.getCurrency(),
            expense.getRate(), expense.getTotal(), expense.getDate(), expense.getBillNo(), expense.getDescription());
    }

    public int update(Expense expense) {
        return jdbcTemplate.update(
            "UPDATE expenses SET expense_type_id = ?, account_id = ?, amount = ?, currency = ?, rate = ?, " +
            "total = ?, date = ?, bill_no = ?, description = ?, updated_at = CURRENT_TIMESTAMP WHERE id = ?",
            expense.getExpenseTypeId(), expense.getAccountId(), expense.getAmount(), expense.getCurrency(),
            expense.getRate(), expense.getTotal(), expense.getDate(), expense.getBillNo(), expense.getDescription(),
            expense.getId());
    }

    public int delete(long id) {
        return jdbcTemplate.update("DELETE FROM expenses WHERE id = ?", id);
    }

    private String searchClause(PageQuery query, List<Object> args) {
        if (!query.hasSearch()) {
            return "";
        }
        args.add(query.searchPattern());
        args.add(query.searchPattern());
        return " WHERE LOWER(COALESCE(bill_no, '')) LIKE ? OR LOWER(COALESCE(description, '')) LIKE ?";
    }

    private RowMapper<Expense> expenseRowMapper() {
        return (rs, rowNum) -> Expense.builder()
            .id(rs.getLong("id"))
            .expenseTypeId(rs.getLong("expense_type_id"))
            .accountId(rs.getObject("account_id", Long.class))
            .amount(rs.getBigDecimal("amount"))
            .currency(rs.getString("currency"))
            .rate(rs.getBigDecimal("rate"))
            .total(rs.getBigDecimal("total"))
            .date(rs.getObject("date", LocalDate.class))
            .billNo(rs.getString("bill_no"))
            .description(rs.getString("description"))
            .build();
    }
}
