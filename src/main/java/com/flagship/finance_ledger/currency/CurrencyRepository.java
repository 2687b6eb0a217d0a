package com.flagship.finance_ledger.currency;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * JDBC access to currencies and their exchange-rate history.
 */
@Repository
@RequiredArgsConstructor
public class CurrencyRepository {

    private static final String CURRENCY_COLUMNS = "SELECT id, name, is_base, rate FROM currencies";

    private final JdbcTemplate jdbcTemplate;

    public Optional<Currency> findById(long id) {
        return jdbcTemplate.query(CURRENCY_COLUMNS + " WHERE id = ?", currencyRowMapper(), id)
            .stream().findFirst();
    }

    public Optional<Currency> findByName(String name) {
        return jdbcTemplate.query(CURRENCY_COLUMNS + " WHERE name = ?", currencyRowMapper(), name)
            .stream().findFirst();
    }

    public Optional<Currency> findBase() {
        return jdbcTemplate.query(CURRENCY_COLUMNS + " WHERE is_base", currencyRowMapper())
            .stream().findFirst();
    }

    public List<Currency> findAll() {
        return jdbcTemplate.query(CURRENCY_COLUMNS + " ORDER BY is_base DESC, name", currencyRowMapper());
    }

    public long insert(String name, boolean base, BigDecimal rate) {
        return jdbcTemplate.queryForObject(
            "INSERT INTO currencies (name, is_base, rate) VALUES (?, ?, ?) RETURNING id",
            Long.class, name, base, rate);
    }

    public int update(long id, String name, boolean base, BigDecimal rate) {
        return jdbcTemplate.update(
            "UPDATE currencies SET name = ?, is_base = ?, rate = ?, updated_at = CURRENT_TIMESTAMP WHERE id = ?",
            name, base, rate, id);
    }

    /**
     * Clears the base flag on every currency except {@code keepId}.
     */
    public void clearBaseExcept(long keepId) {
        jdbcTemplate.update(
            "UPDATE currencies SET is_base = FALSE, updated_at = CURRENT_TIMESTAMP WHERE is_base AND id <> ?",
            keepId);
    }

    public void markBase(long id) {
        jdbcTemplate.update(
            "UPDATE currencies SET is_base = TRUE, updated_at = CURRENT_TIMESTAMP WHERE id = ?", id);
    }

    public int delete(long id) {
        return jdbcTemplate.update("DELETE FROM currencies WHERE id = ?", id);
    }

    /**
     * Counts rows in other tables that still point at this currency.
     */
    public long countReferences(long id) {
        Long count = jdbcTemplate.queryForObject(
            "SELECT (SELECT COUNT(*) FROM accounts WHERE currency_id = ?) " +
            "     + (SELECT COUNT(*) FROM account_currency_balances WHERE currency_id = ?) " +
            "     + (SELECT COUNT(*) FROM journal_entry_lines WHERE currency_id = ?) " +
            "     + (SELECT COUNT(*) FROM sales WHERE currency_id = ?) " +
            "     + (SELECT COUNT(*) FROM sale_payments WHERE currency_id = ?) " +
            "     + (SELECT COUNT(*) FROM purchases WHERE currency_id = ?) " +
            "     + (SELECT COUNT(*) FROM products WHERE currency_id = ?) " +
            "     + (SELECT COUNT(*) FROM services WHERE currency_id = ?)",
            Long.class, id, id, id, id, id, id, id, id);
        return count != null ? count : 0L;
    }

    /**
     * Counts rows that record this currency by name. Reversing them resolves
     * the name again, so a referenced name must not change.
     */
    public long countNameReferences(String name) {
        Long count = jdbcTemplate.queryForObject(
            "SELECT (SELECT COUNT(*) FROM account_transactions WHERE currency = ?) " +
            "     + (SELECT COUNT(*) FROM purchase_payments WHERE currency = ?) " +
            "     + (SELECT COUNT(*) FROM expenses WHERE currency = ?) " +
            "     + (SELECT COUNT(*) FROM deductions WHERE currency = ?)",
            Long.class, name, name, name, name);
        return count != null ? count : 0L;
    }

    public long insertExchangeRate(long fromCurrencyId, long toCurrencyId, BigDecimal rate, LocalDate date) {
        return jdbcTemplate.queryForObject(
            "INSERT INTO currency_exchange_rates (from_currency_id, to_currency_id, rate, date) " +
            "VALUES (?, ?, ?, ?) RETURNING id",
            Long.class, fromCurrencyId, toCurrencyId, rate, date);
    }

    /**
     * Latest rate recorded for the pair on or before {@code date}.
     */
    public Optional<ExchangeRate> findLatestRate(long fromCurrencyId, long toCurrencyId, LocalDate date) {
        return jdbcTemplate.query(
            "SELECT id, from_currency_id, to_currency_id, rate, date FROM currency_exchange_rates " +
            "WHERE from_currency_id = ? AND to_currency_id = ? AND date <= ? " +
            "ORDER BY date DESC, id DESC LIMIT 1",
            exchangeRateRowMapper(), fromCurrencyId, toCurrencyId, date)
            .stream().findFirst();
    }

    public List<ExchangeRate> findRateHistory(long fromCurrencyId, long toCurrencyId) {
        return jdbcTemplate.query(
            "SELECT id, from_currency_id, to_currency_id, rate, date FROM currency_exchange_rates " +
            "WHERE from_currency_id = ? AND to_currency_id = ? ORDER BY date DESC, id DESC",
            exchangeRateRowMapper(), fromCurrencyId, toCurrencyId);
    }

    private RowMapper<Currency> currencyRowMapper() {
        return (rs, rowNum) -> Currency.builder()
            .id(rs.getLong("id"))
            .name(rs.getString("name"))
            .base(rs.getBoolean("is_base"))
            .rate(rs.getBigDecimal("rate"))
            .build();
    }

    private RowMapper<ExchangeRate> exchangeRateRowMapper() {
        return (rs, rowNum) -> ExchangeRate.builder()
            .id(rs.getLong("id"))
            .fromCurrencyId(rs.getLong("from_currency_id"))
            .toCurrencyId(rs.getLong("to_currency_id"))
            .rate(rs.getBigDecimal("rate"))
            .date(rs.getObject("date", LocalDate.class))
            .build();
    }
}
