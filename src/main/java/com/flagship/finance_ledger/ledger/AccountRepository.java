package com.flagship.finance_ledger.ledger;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Account rows and balance read models. Writes to balances live in
 * {@link BalanceLedger}.
 */
@Repository
@RequiredArgsConstructor
public class AccountRepository {

    private static final String COLUMNS =
        "SELECT id, name, currency_id, coa_category_id, account_code, account_type, " +
        "initial_balance, current_balance, is_active, notes FROM accounts";

    private final JdbcTemplate jdbcTemplate;

    public Optional<Account> findById(long id) {
        return jdbcTemplate.query(COLUMNS + " WHERE id = ?", accountRowMapper(), id).stream().findFirst();
    }

    public List<Account> findAll() {
        return jdbcTemplate.query(COLUMNS + " ORDER BY name, id", accountRowMapper());
    }

    public long insert(Account account) {
        return jdbcTemplate.queryForObject(
            "INSERT INTO accounts (name, currency_id, coa_category_id, account_code, account_type, " +
            "initial_balance, is_active, notes) VALUES (?, ?, ?, ?, ?, ?, ?, ?) RETURNING id",
            Long.class,
            account.getName(), account.getCurrencyId(), account.getCoaCategoryId(), account.getAccountCode(),
            account.getAccountType(), account.getInitialBalance(), account.isActive(), account.getNotes());
    }

    public int update(Account account) {
        return jdbcTemplate.update(
            "UPDATE accounts SET name = ?, currency_id = ?, coa_category_id = ?, account_code = ?, " +
            "account_type = ?, initial_balance = ?, is_active = ?, notes = ?, updated_at = CURRENT_TIMESTAMP " +
            "WHERE id = ?",
            account.getName(), account.getCurrencyId(), account.getCoaCategoryId(), account.getAccountCode(),
            account.getAccountType(), account.getInitialBalance(), account.isActive(), account.getNotes(),
            account.getId());
    }

    public int delete(long id) {
        return jdbcTemplate.update("DELETE FROM accounts WHERE id = ?", id);
    }

    public long countJournalLines(long accountId) {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM journal_entry_lines WHERE account_id = ?", Long.class, accountId);
        return count != null ? count : 0L;
    }

    public List<AccountCurrencyBalance> findBalances(long accountId) {
        return jdbcTemplate.query(
            "SELECT b.account_id, b.currency_id, c.name AS currency_name, b.balance " +
            "FROM account_currency_balances b JOIN currencies c ON c.id = b.currency_id " +
            "WHERE b.account_id = ? ORDER BY c.is_base DESC, c.name",
            balanceRowMapper(), accountId);
    }

    public List<AccountCurrencyBalance> findAllBalances() {
        return jdbcTemplate.query(
            "SELECT b.account_id, b.currency_id, c.name AS currency_name, b.balance " +
            "FROM account_currency_balances b JOIN currencies c ON c.id = b.currency_id " +
            "ORDER BY b.account_id, c.is_base DESC, c.name",
            balanceRowMapper());
    }

    public BigDecimal sumJournalDebits(long accountId, long currencyId) {
        return jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(debit_amount), 0) FROM journal_entry_lines WHERE account_id = ? AND currency_id = ?",
            BigDecimal.class, accountId, currencyId);
    }

    public BigDecimal sumJournalCredits(long accountId, long currencyId) {
        return jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(credit_amount), 0) FROM journal_entry_lines WHERE account_id = ? AND currency_id = ?",
            BigDecimal.class, accountId, currencyId);
    }

    private RowMapper<Account> accountRowMapper() {
        return (rs, rowNum) -> Account.builder()
            .id(rs.getLong("id"))
            .name(rs.getString("name"))
            .currencyId(rs.getObject("currency_id", Long.class))
            .coaCategoryId(rs.getObject("coa_category_id", Long.class))
            .accountCode(rs.getString("account_code"))
            .accountType(rs.getString("account_type"))
            .initialBalance(rs.getBigDecimal("initial_balance"))
            .currentBalance(rs.getBigDecimal("current_balance"))
            .active(rs.getBoolean("is_active"))
            .notes(rs.getString("notes"))
            .build();
    }

    private RowMapper<AccountCurrencyBalance> balanceRowMapper() {
        return (rs, rowNum) -> AccountCurrencyBalance.builder()
            .accountId(rs.getLong("account_id"))
            .currencyId(rs.getLong("currency_id"))
            .currencyName(rs.getString("currency_name"))
            .balance(rs.getBigDecimal("balance"))
            .build();
    }
}
