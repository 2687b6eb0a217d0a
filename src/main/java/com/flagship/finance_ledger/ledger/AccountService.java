package com.flagship.finance_ledger.ledger;

import com.flagship.finance_ledger.common.Money;
import com.flagship.finance_ledger.exception.DuplicateEntryException;
import com.flagship.finance_ledger.exception.NotFoundException;
import com.flagship.finance_ledger.exception.ReferentialConflictException;
import com.flagship.finance_ledger.exception.ValidationFailedException;
import com.flagship.finance_ledger.ledger.dto.AccountRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;

/**
 * Account records, balance queries and reconciliation.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountService {

    private static final BigDecimal RECONCILE_TOLERANCE = new BigDecimal("0.01");

    private final AccountRepository accountRepository;
    private final BalanceLedger balanceLedger;

    @Transactional
    public Account create(AccountRequest request) {
        Account account = toAccount(null, request);
        long id;
        try {
            id = accountRepository.insert(account);
        } catch (DuplicateKeyException e) {
            throw new DuplicateEntryException("Account code already exists: " + account.getAccountCode(), e);
        }
        balanceLedger.recomputeCurrentBalance(id);
        log.info("Account created: id={}, name={}, initialBalance={}", id, account.getName(), account.getInitialBalance());
        return get(id);
    }

    /**
     * Updates the account and recomputes its current balance, since the
     * initial balance may have changed.
     */
    @Transactional
    public Account update(long id, AccountRequest request) {
        balanceLedger.lockAccount(id);
        Account account = toAccount(id, request);
        try {
            accountRepository.update(account);
        } catch (DuplicateKeyException e) {
            throw new DuplicateEntryException("Account code already exists: " + account.getAccountCode(), e);
        }
        balanceLedger.recomputeCurrentBalance(id);
        return get(id);
    }

    @Transactional
    public void delete(long id) {
        get(id);
        if (accountRepository.countJournalLines(id) > 0) {
            throw new ReferentialConflictException("Account is referenced by journal entries and cannot be deleted");
        }
        accountRepository.delete(id);
        log.info("Account deleted: id={}", id);
    }

    @Transactional(readOnly = true)
    public Account get(long id) {
        return accountRepository.findById(id).orElseThrow(() -> NotFoundException.of("Account", id));
    }

    @Transactional(readOnly = true)
    public List<Account> list() {
        return accountRepository.findAll();
    }

    @Transactional(readOnly = true)
    public BigDecimal getBalanceByCurrency(long accountId, long currencyId) {
        get(accountId);
        return balanceLedger.getBalance(accountId, currencyId);
    }

    @Transactional(readOnly = true)
    public List<AccountCurrencyBalance> getCurrencyBalances(long accountId) {
        get(accountId);
        return accountRepository.findBalances(accountId);
    }

    @Transactional(readOnly = true)
    public List<AccountCurrencyBalance> getAllCurrencyBalances() {
        return accountRepository.findAllBalances();
    }

    /**
     * Compares the stored currency balance with the net of journal lines for
     * the same account and currency.
     */
    @Transactional(readOnly = true)
    public BalanceReconciliation reconcile(long accountId, long currencyId) {
        get(accountId);
        BigDecimal accountBalance = balanceLedger.getBalance(accountId, currencyId);
        BigDecimal debits = Money.orZero(accountRepository.sumJournalDebits(accountId, currencyId));
        BigDecimal credits = Money.orZero(accountRepository.sumJournalCredits(accountId, currencyId));
        BigDecimal journalBalance = debits.subtract(credits);
        BigDecimal difference = accountBalance.subtract(journalBalance);

        return BalanceReconciliation.builder()
            .accountId(accountId)
            .currencyId(currencyId)
            .accountBalance(accountBalance)
            .journalDebits(debits)
            .journalCredits(credits)
            .journalBalance(journalBalance)
            .difference(difference)
            .balanced(difference.abs().compareTo(RECONCILE_TOLERANCE) < 0)
            .build();
    }

    private Account toAccount(Long id, AccountRequest request) {
        if (request.getName() == null || request.getName().isBlank()) {
            throw new ValidationFailedException("Account name is required");
        }
        String code = request.getAccountCode();
        return Account.builder()
            .id(id)
            .name(request.getName().trim())
            .currencyId(request.getCurrencyId())
            .coaCategoryId(request.getCoaCategoryId())
            .accountCode(code != null && !code.isBlank() ? code.trim() : null)
            .accountType(request.getAccountType())
            .initialBalance(Money.orZero(request.getInitialBalance()))
            .active(request.isActive())
            .notes(request.getNotes())
            .build();
    }
}
