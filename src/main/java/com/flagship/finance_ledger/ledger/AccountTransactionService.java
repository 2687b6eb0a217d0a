package com.flagship.finance_ledger.ledger;

import com.flagship.finance_ledger.common.Money;
import com.flagship.finance_ledger.currency.Currency;
import com.flagship.finance_ledger.currency.CurrencyService;
import com.flagship.finance_ledger.exception.InsufficientFundsException;
import com.flagship.finance_ledger.exception.ValidationFailedException;
import com.flagship.finance_ledger.ledger.dto.AccountTransactionRequest;
import com.flagship.finance_ledger.observability.CorrelationContext;
import com.flagship.finance_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Deposits, withdrawals and the account side of payments and expenses.
 *
 * Every movement follows the same sequence inside the caller's transaction:
 * lock the account, check funds (withdrawals only), apply the per-currency
 * delta, append the audit row, recompute current_balance.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountTransactionService {

    private final BalanceLedger balanceLedger;
    private final AccountTransactionRepository transactionRepository;
    private final CurrencyService currencyService;
    private final LedgerMetrics ledgerMetrics;

    /**
     * Deposits into an account. With {@code is_full} the moved amount is the
     * account's whole current balance (clamped at 0) expressed in the currency.
     */
    @Transactional
    public AccountTransaction deposit(AccountTransactionRequest request) {
        return manualMovement(request, TransactionType.DEPOSIT);
    }

    /**
     * Withdraws from an account. A non-full withdrawal must pass both the
     * current-balance check and the per-currency check.
     */
    @Transactional
    public AccountTransaction withdraw(AccountTransactionRequest request) {
        return manualMovement(request, TransactionType.WITHDRAW);
    }

    /**
     * Money flowing into an account from a sale payment.
     */
    @Transactional
    public AccountTransaction credit(long accountId, Currency currency, BigDecimal amount, BigDecimal rate,
                                     LocalDate date, String notes) {
        balanceLedger.lockAccount(accountId);
        return post(accountId, currency, TransactionType.DEPOSIT, amount, rate, date, false, notes);
    }

    /**
     * Money leaving an account for a purchase payment or an expense.
     *
     * @throws InsufficientFundsException if either sufficiency check fails
     */
    @Transactional
    public AccountTransaction debit(long accountId, Currency currency, BigDecimal amount, BigDecimal rate,
                                    LocalDate date, String notes) {
        BigDecimal currentBalance = balanceLedger.lockAccount(accountId);
        requireFunds(accountId, currentBalance, currency, amount, rate);
        return post(accountId, currency, TransactionType.WITHDRAW, amount, rate, date, false, notes);
    }

    /**
     * Undoes an earlier {@link #credit}. Never blocked by funds, so deleting a
     * payment always succeeds.
     */
    @Transactional
    public AccountTransaction reverseCredit(long accountId, Currency currency, BigDecimal amount, BigDecimal rate,
                                            LocalDate date, String notes) {
        balanceLedger.lockAccount(accountId);
        return post(accountId, currency, TransactionType.WITHDRAW, amount, rate, date, false, "Reversal: " + notes);
    }

    /**
     * Undoes an earlier {@link #debit}.
     */
    @Transactional
    public AccountTransaction reverseDebit(long accountId, Currency currency, BigDecimal amount, BigDecimal rate,
                                           LocalDate date, String notes) {
        balanceLedger.lockAccount(accountId);
        return post(accountId, currency, TransactionType.DEPOSIT, amount, rate, date, false, "Reversal: " + notes);
    }

    @Transactional(readOnly = true)
    public List<AccountTransaction> getTransactions(long accountId) {
        return transactionRepository.findByAccount(accountId);
    }

    private AccountTransaction manualMovement(AccountTransactionRequest request, TransactionType type) {
        Currency currency = currencyService.requireByName(request.getCurrency());
        BigDecimal rate = request.getRate() != null ? request.getRate() : currency.getRate();
        if (rate == null || rate.signum() <= 0) {
            throw new ValidationFailedException("Rate must be greater than 0");
        }
        if (!request.isFull() && !Money.isPositive(request.getAmount())) {
            throw new ValidationFailedException("Amount must be greater than 0");
        }

        long accountId = request.getAccountId();
        MDC.put(CorrelationContext.ACCOUNT_ID_MDC_KEY, String.valueOf(accountId));
        try {
            BigDecimal currentBalance = balanceLedger.lockAccount(accountId);
            BigDecimal amount;
            if (request.isFull()) {
                amount = Money.divide(currentBalance.max(BigDecimal.ZERO), rate);
            } else {
                amount = request.getAmount();
                if (type == TransactionType.WITHDRAW) {
                    requireFunds(accountId, currentBalance, currency, amount, rate);
                }
            }
            return post(accountId, currency, type, amount, rate, request.getTransactionDate(),
                request.isFull(), request.getNotes());
        } finally {
            MDC.remove(CorrelationContext.ACCOUNT_ID_MDC_KEY);
        }
    }

    private void requireFunds(long accountId, BigDecimal currentBalance, Currency currency,
                              BigDecimal amount, BigDecimal rate) {
        BigDecimal total = amount.multiply(rate);
        if (total.compareTo(currentBalance) > 0) {
            ledgerMetrics.recordRejectedCheck("funds");
            log.warn("Insufficient funds: account={}, currentBalance={}, requested={}", accountId, currentBalance, total);
            throw new InsufficientFundsException(
                "Insufficient funds: account balance " + plain(currentBalance) + " is less than " + plain(total));
        }
        BigDecimal currencyBalance = balanceLedger.getBalance(accountId, currency.getId());
        if (amount.compareTo(currencyBalance) > 0) {
            ledgerMetrics.recordRejectedCheck("funds");
            log.warn("Insufficient currency balance: account={}, currency={}, available={}, requested={}",
                accountId, currency.getName(), currencyBalance, amount);
            throw new InsufficientFundsException(
                "Insufficient funds in " + currency.getName() + ": available " + plain(currencyBalance)
                    + ", requested " + plain(amount));
        }
    }

    private AccountTransaction post(long accountId, Currency currency, TransactionType type, BigDecimal amount,
                                    BigDecimal rate, LocalDate date, boolean full, String notes) {
        BigDecimal delta = type == TransactionType.DEPOSIT ? amount : amount.negate();
        balanceLedger.applyDelta(accountId, currency.getId(), delta);

        AccountTransaction saved = transactionRepository.insert(AccountTransaction.builder()
            .accountId(accountId)
            .transactionType(type)
            .amount(amount)
            .currency(currency.getName())
            .rate(rate)
            .total(amount.multiply(rate))
            .transactionDate(date)
            .full(full)
            .notes(notes)
            .build());

        BigDecimal currentBalance = balanceLedger.recomputeCurrentBalance(accountId);
        ledgerMetrics.recordBalanceMovement(type.dbValue(), currency.getName());
        log.info("Account {}: account={}, amount={} {}, currentBalance={}",
            type.dbValue(), accountId, amount, currency.getName(), currentBalance);
        return saved;
    }

    private static String plain(BigDecimal value) {
        return value.stripTrailingZeros().toPlainString();
    }
}
