package com.flagship.finance_ledger.ledger;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

/**
 * Append-only store for deposit/withdraw audit rows.
 */
@Repository
@RequiredArgsConstructor
public class AccountTransactionRepository {

    private final JdbcTemplate jdbcTemplate;

    public AccountTransaction insert(AccountTransaction tx) {
        Long id = jdbcTemplate.queryForObject(
            "INSERT INTO account_transactions " +
            "(account_id, transaction_type, amount, currency, rate, total, transaction_date, is_full, notes) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?) RETURNING id",
            Long.class,
            tx.getAccountId(), tx.getTransactionType().dbValue(), tx.getAmount(), tx.getCurrency(),
            tx.getRate(), tx.getTotal(), tx.getTransactionDate(), tx.isFull(), tx.getNotes());
        return AccountTransaction.builder()
            .id(id)
            .accountId(tx.getAccountId())
            .transactionType(tx.getTransactionType())
            .amount(tx.getAmount())
            .currency(tx.getCurrency())
            .rate(tx.getRate())
            .total(tx.getTotal())
            .transactionDate(tx.getTransactionDate())
            .full(tx.isFull())
            .notes(tx.getNotes())
            .build();
    }

    public List<AccountTransaction> findByAccount(long accountId) {
        return jdbcTemplate.query(
            "SELECT id, account_id, transaction_type, amount, currency, rate, total, transaction_date, is_full, notes " +
            "FROM account_transactions WHERE account_id = ? ORDER BY transaction_date DESC, id DESC",
            rowMapper(), accountId);
    }

    private RowMapper<AccountTransaction> rowMapper() {
        return (rs, rowNum) -> AccountTransaction.builder()
            .id(rs.getLong("id"))
            .accountId(rs.getLong("account_id"))
            .transactionType(TransactionType.fromDbValue(rs.getString("transaction_type")))
            .amount(rs.getBigDecimal("amount"))
            .currency(rs.getString("currency"))
            .rate(rs.getBigDecimal("rate"))
            .total(rs.getBigDecimal("total"))
            .transactionDate(rs.getObject("transaction_date", LocalDate.class))
            .full(rs.getBoolean("is_full"))
            .notes(rs.getString("notes"))
            .build();
    }
}
