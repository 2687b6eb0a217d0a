package com.flagship.finance_ledger.ledger;

import com.flagship.finance_ledger.exception.NotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;

/**
 * The only component that writes account_currency_balances and
 * accounts.current_balance.
 *
 * Every money movement reduces to {@link #applyDelta} calls followed by
 * {@link #recomputeCurrentBalance}. The recompute formula is the same on
 * every path:
 *
 * <pre>
 * current_balance = initial_balance + &Sigma;(currency balance &times; currency rate)
 * </pre>
 *
 * Callers run inside a transaction and take {@link #lockAccount} before any
 * read-check-write sequence, so concurrent movements on one account serialize.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BalanceLedger {

    private final JdbcTemplate jdbcTemplate;

    /**
     * Balance held in one currency; 0 when the account never moved it.
     */
    public BigDecimal getBalance(long accountId, long currencyId) {
        List<BigDecimal> rows = jdbcTemplate.queryForList(
            "SELECT balance FROM account_currency_balances WHERE account_id = ? AND currency_id = ?",
            BigDecimal.class, accountId, currencyId);
        return rows.isEmpty() || rows.get(0) == null ? BigDecimal.ZERO : rows.get(0);
    }

    /**
     * Adds {@code delta} to the (account, currency) balance, creating the row
     * on first movement.
     */
    public void applyDelta(long accountId, long currencyId, BigDecimal delta) {
        jdbcTemplate.update(
            "INSERT INTO account_currency_balances (account_id, currency_id, balance) VALUES (?, ?, ?) " +
            "ON CONFLICT (account_id, currency_id) DO UPDATE " +
            "SET balance = account_currency_balances.balance + EXCLUDED.balance, updated_at = CURRENT_TIMESTAMP",
            accountId, currencyId, delta);
        log.debug("Applied delta: account={}, currency={}, delta={}", accountId, currencyId, delta);
    }

    /**
     * Recomputes and stores the account's current balance.
     *
     * @return the new current balance
     */
    public BigDecimal recomputeCurrentBalance(long accountId) {
        List<BigDecimal> rows = jdbcTemplate.queryForList(
            "UPDATE accounts a SET current_balance = a.initial_balance + COALESCE(( " +
            "    SELECT SUM(b.balance * c.rate) FROM account_currency_balances b " +
            "    JOIN currencies c ON c.id = b.currency_id WHERE b.account_id = a.id), 0), " +
            "  updated_at = CURRENT_TIMESTAMP " +
            "WHERE a.id = ? RETURNING current_balance",
            BigDecimal.class, accountId);
        if (rows.isEmpty()) {
            throw NotFoundException.of("Account", accountId);
        }
        return rows.get(0);
    }

    /**
     * Row-locks the account for the rest of the current transaction and
     * returns its current balance.
     *
     * @throws NotFoundException if the account does not exist
     */
    public BigDecimal lockAccount(long accountId) {
        List<BigDecimal> rows = jdbcTemplate.queryForList(
            "SELECT current_balance FROM accounts WHERE id = ? FOR UPDATE",
            BigDecimal.class, accountId);
        if (rows.isEmpty()) {
            throw NotFoundException.of("Account", accountId);
        }
        return rows.get(0);
    }

    /**
     * Recomputes every account holding the currency, after its rate changed.
     */
    public void recomputeAccountsHolding(long currencyId) {
        List<Long> accountIds = jdbcTemplate.queryForList(
            "SELECT account_id FROM account_currency_balances WHERE currency_id = ? ORDER BY account_id",
            Long.class, currencyId);
        accountIds.forEach(this::recomputeCurrentBalance);
    }
}
