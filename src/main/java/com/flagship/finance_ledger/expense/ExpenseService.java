package com.flagship.finance_ledger.expense;

import com.flagship.finance_ledger.common.Money;
import com.flagship.finance_ledger.common.PageQuery;
import com.flagship.finance_ledger.common.PagedResult;
import com.flagship.finance_ledger.currency.Currency;
import com.flagship.finance_ledger.currency.CurrencyService;
import com.flagship.finance_ledger.exception.DuplicateEntryException;
import com.flagship.finance_ledger.exception.NotFoundException;
import com.flagship.finance_ledger.exception.ReferentialConflictException;
import com.flagship.finance_ledger.exception.ValidationFailedException;
import com.flagship.finance_ledger.expense.dto.ExpenseRequest;
import com.flagship.finance_ledger.expense.dto.ExpenseTypeRequest;
import com.flagship.finance_ledger.ledger.AccountTransactionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;

/**
 * Expense types and expenses. An expense paid from an account withdraws
 * from it like any other withdrawal; editing an expense reverses the old
 * withdrawal before applying the new one, and deleting it reverses it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExpenseService {

    private final ExpenseRepository expenseRepository;
    private final AccountTransactionService accountTransactionService;
    private final CurrencyService currencyService;

    // ==================== Expense types ====================

    @Transactional
    public ExpenseType createType(ExpenseTypeRequest request) {
        String name = requireName(request);
        try {
            long id = expenseRepository.insertType(name);
            return getType(id);
        } catch (DuplicateKeyException e) {
            throw new DuplicateEntryException("Expense type already exists: " + name);
        }
    }

    @Transactional
    public ExpenseType updateType(long id, ExpenseTypeRequest request) {
        getType(id);
        String name = requireName(request);
        try {
            expenseRepository.updateType(id, name);
        } catch (DuplicateKeyException e) {
            throw new DuplicateEntryException("Expense type already exists: " + name);
        }
        return getType(id);
    }

    @Transactional
    public void deleteType(long id) {
        getType(id);
        if (expenseRepository.countExpensesOfType(id) > 0) {
            throw new ReferentialConflictException("Expense type " + id + " is used by expenses");
        }
        expenseRepository.deleteType(id);
    }

    @Transactional(readOnly = true)
    public ExpenseType getType(long id) {
        return expenseRepository.findType(id).orElseThrow(() -> NotFoundException.of("Expense type", id));
    }

    @Transactional(readOnly = true)
    public List<ExpenseType> listTypes() {
        return expenseRepository.findAllTypes();
    }

    // ==================== Expenses ====================

    @Transactional
    public Expense create(ExpenseRequest request) {
        ExpenseType type = requireType(request);
        Currency currency = currencyService.requireByName(request.getCurrency());
        BigDecimal rate = rateOf(request, currency);
        validateAmount(request);

        Expense expense = toExpense(null, request, currency, rate);
        if (expense.getAccountId() != null) {
            withdraw(expense, currency, type);
        }
        long id = expenseRepository.insert(expense);
        log.info("Expense created: id={}, type={}, account={}, amount={} {}",
            id, type.getName(), request.getAccountId(), request.getAmount(), currency.getName());
        return get(id);
    }

    @Transactional
    public Expense update(long id, ExpenseRequest request) {
        Expense existing = get(id);
        ExpenseType type = requireType(request);
        Currency currency = currencyService.requireByName(request.getCurrency());
        BigDecimal rate = rateOf(request, currency);
        validateAmount(request);

        reverse(existing);
        Expense updated = toExpense(id, request, currency, rate);
        if (updated.getAccountId() != null) {
            withdraw(updated, currency, type);
        }
        expenseRepository.update(updated);
        log.info("Expense updated: id={}, account={}, amount={} {}",
            id, request.getAccountId(), request.getAmount(), currency.getName());
        return get(id);
    }

    @Transactional
    public void delete(long id) {
        Expense existing = get(id);
        reverse(existing);
        expenseRepository.delete(id);
        log.info("Expense deleted: id={}", id);
    }

    @Transactional(readOnly = true)
    public Expense get(long id) {
        return expenseRepository.findById(id).orElseThrow(() -> NotFoundException.of("Expense", id));
    }

    @Transactional(readOnly = true)
    public PagedResult<Expense> list(PageQuery query) {
        return PagedResult.of(expenseRepository.findPage(query), expenseRepository.count(query), query);
    }

    private void withdraw(Expense expense, Currency currency, ExpenseType type) {
        accountTransactionService.debit(expense.getAccountId(), currency, expense.getAmount(), expense.getRate(),
            expense.getDate(), "Expense: " + type.getName());
    }

    private void reverse(Expense expense) {
        if (expense.getAccountId() == null) {
            return;
        }
        Currency currency = currencyService.requireByName(expense.getCurrency());
        String typeName = expenseRepository.findType(expense.getExpenseTypeId())
            .map(ExpenseType::getName)
            .orElse(String.valueOf(expense.getExpenseTypeId()));
        accountTransactionService.reverseDebit(expense.getAccountId(), currency, expense.getAmount(),
            expense.getRate(), expense.getDate(), "Expense: " + typeName);
    }

    private ExpenseType requireType(ExpenseRequest request) {
        if (request.getExpenseTypeId() == null) {
            throw new ValidationFailedException("Expense type is required");
        }
        return getType(request.getExpenseTypeId());
    }

    private static BigDecimal rateOf(ExpenseRequest request, Currency currency) {
        BigDecimal rate = request.getRate() != null ? request.getRate() : currency.getRate();
        if (rate == null || rate.signum() <= 0) {
            throw new ValidationFailedException("Rate must be greater than 0");
        }
        return rate;
    }

    private static void validateAmount(ExpenseRequest request) {
        if (!Money.isPositive(request.getAmount())) {
            throw new ValidationFailedException("Amount must be greater than 0");
        }
        if (request.getDate() == null) {
            throw new ValidationFailedException("Date is required");
        }
    }

    private static Expense toExpense(Long id, ExpenseRequest request, Currency currency, BigDecimal rate) {
        return Expense.builder()
            .id(id)
            .expenseTypeId(request.getExpenseTypeId())
            .accountId(request.getAccountId())
            .amount(request.getAmount())
            .currency(currency.getName())
            .rate(rate)
            .total(Money.round6(request.getAmount().multiply(rate)))
            .date(request.getDate())
            .billNo(request.getBillNo())
            .description(request.getDescription())
            .build();
    }

    private static String requireName(ExpenseTypeRequest request) {
        if (request.getName() == null || request.getName().isBlank()) {
            throw new ValidationFailedException("Name is required");
        }
        return request.getName().trim();
    }
}
