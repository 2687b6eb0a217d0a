package com.flagship.finance_ledger.journal;

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
public class JournalEntryRepository {

    private static final String ENTRY_COLUMNS =
        "SELECT id, entry_number, entry_date, description, reference_type, reference_id FROM journal_entries";
    private static final String LINE_COLUMNS =
        "SELECT id, journal_entry_id, account_id, currency_id, debit_amount, credit_amount, exchange_rate, " +
        "base_amount, description FROM journal_entry_lines";
    private static final Set<String> SORTABLE = Set.of("entry_date", "entry_number", "created_at");

    private final JdbcTemplate jdbcTemplate;

    public Optional<JournalEntry> findById(long id) {
        return jdbcTemplate.query(ENTRY_COLUMNS + " WHERE id = ?", entryRowMapper(), id).stream().findFirst();
    }

    public boolean lock(long id) {
        return !jdbcTemplate.queryForList("SELECT id FROM journal_entries WHERE id = ? FOR UPDATE", Long.class, id)
            .isEmpty();
    }

    public List<JournalEntry> findPage(PageQuery query) {
        List<Object> args = new ArrayList<>();
        String where = searchClause(query, args);
        args.add(query.getPerPage());
        args.add(query.offset());
        return jdbcTemplate.query(
            ENTRY_COLUMNS + where + query.orderBy(SORTABLE, "entry_date") + " LIMIT ? OFFSET ?",
            entryRowMapper(), args.toArray());
    }

    public long count(PageQuery query) {
        List<Object> args = new ArrayList<>();
        String where = searchClause(query, args);
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM journal_entries" + where, Long.class,
            args.toArray());
        return count != null ? count : 0L;
    }

    public long insert(JournalEntry entry) {
        return jdbcTemplate.queryForObject(
            "INSERT INTO journal_entries (entry_number, entry_date, description, reference_type, reference_id) " +
            "VALUES (?, ?, ?, ?, ?) RETURNING id",
            Long.class,
            entry.getEntryNumber(), entry.getEntryDate(), entry.getDescription(), entry.getReferenceType(),
            entry.getReferenceId());
    }

    public int updateHeader(JournalEntry entry) {
        return jdbcTemplate.update(
            "UPDATE journal_entries SET entry_date = ?, description = ?, reference_type = ?, reference_id = ?, " +
            "updated_at = CURRENT_TIMESTAMP WHERE id = ?",
            entry.getEntryDate(), entry.getDescription(), entry.getReferenceType(), entry.getReferenceId(),
            entry.getId());
    }

    public int delete(long id) {
        return jdbcTemplate.update("DELETE FROM journal_entries WHERE id = ?", id);
    }

    public List<JournalEntryLine> findLines(long entryId) {
        return jdbcTemplate.query(LINE_COLUMNS + " WHERE journal_entry_id = ? ORDER BY id", lineRowMapper(), entryId);
    }

    public long insertLine(JournalEntryLine line) {
        return jdbcTemplate.queryForObject(
            "INSERT INTO journal_entry_lines (journal_entry_id, account_id, currency_id, debit_amount, " +
            "credit_amount, exchange_rate, base_amount, description) VALUES (?, ?, ?, ?, ?, ?, ?, ?) RETURNING id",
            Long.class,
            line.getJournalEntryId(), line.getAccountId(), line.getCurrencyId(), line.getDebitAmount(),
            line.getCreditAmount(), line.getExchangeRate(), line.getBaseAmount(), line.getDescription());
    }

    public int deleteLines(long entryId) {
        return jdbcTemplate.update("DELETE FROM journal_entry_lines WHERE journal_entry_id = ?", entryId);
    }

    private String searchClause(PageQuery query, List<Object> args) {
        if (!query.hasSearch()) {
            return "";
        }
        args.add(query.searchPattern());
        args.add(query.searchPattern());
        return " WHERE LOWER(entry_number) LIKE ? OR LOWER(COALESCE(description, '')) LIKE ?";
    }

    private RowMapper<JournalEntry> entryRowMapper() {
        return (rs, rowNum) -> JournalEntry.builder()
            .id(rs.getLong("id"))
            .entryNumber(rs.getString("entry_number"))
            .entryDate(rs.getObject("entry_date", LocalDate.class))
            .description(rs.getString("description"))
            .referenceType(rs.getString("reference_type"))
            .referenceId(rs.getObject("reference_id", Long.class))
            .build();
    }

    private RowMapper<JournalEntryLine> lineRowMapper() {
        return (rs, rowNum) -> JournalEntryLine.builder()
            .id(rs.getLong("id"))
            .journalEntryId(rs.getLong("journal_entry_id"))
            .accountId(rs.getLong("account_id"))
            .currencyId(rs.getLong("currency_id"))
            .debitAmount(rs.getBigDecimal("debit_amount"))
            .creditAmount(rs.getBigDecimal("credit_amount"))
            .exchangeRate(rs.getBigDecimal("exchange_rate"))
            .baseAmount(rs.getBigDecimal("base_amount"))
            .description(rs.getString("description"))
            .build();
    }
}
