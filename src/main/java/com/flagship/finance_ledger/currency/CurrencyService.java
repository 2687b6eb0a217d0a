package com.flagship.finance_ledger.currency;

import com.flagship.finance_ledger.currency.dto.CurrencyRequest;
import com.flagship.finance_ledger.currency.dto.ExchangeRateRequest;
import com.flagship.finance_ledger.exception.CurrencyNotFoundException;
import com.flagship.finance_ledger.exception.DuplicateEntryException;
import com.flagship.finance_ledger.exception.NotFoundException;
import com.flagship.finance_ledger.exception.ReferentialConflictException;
import com.flagship.finance_ledger.exception.ValidationFailedException;
import com.flagship.finance_ledger.ledger.BalanceLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Currency catalog and exchange-rate history.
 *
 * Invariant: at most one currency has is_base = true. Making a currency
 * base clears the flag everywhere else in the same transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CurrencyService {

    private final CurrencyRepository currencyRepository;
    private final BalanceLedger balanceLedger;

    @Transactional
    public Currency create(CurrencyRequest request) {
        String name = normalizeName(request.getName());
        long id;
        try {
            id = currencyRepository.insert(name, false, request.getRate());
        } catch (DuplicateKeyException e) {
            throw new DuplicateEntryException("Currency already exists: " + name, e);
        }
        if (request.isBase()) {
            makeBase(id);
        }
        log.info("Currency created: id={}, name={}, base={}", id, name, request.isBase());
        return get(id);
    }

    @Transactional
    public Currency update(long id, CurrencyRequest request) {
        Currency existing = get(id);
        String name = normalizeName(request.getName());
        if (!name.equals(existing.getName()) && currencyRepository.countNameReferences(existing.getName()) > 0) {
            throw new ReferentialConflictException(
                "Currency " + existing.getName() + " is recorded by name on payments or transactions and cannot be renamed");
        }
        try {
            currencyRepository.update(id, name, existing.isBase(), request.getRate());
        } catch (DuplicateKeyException e) {
            throw new DuplicateEntryException("Currency already exists: " + name, e);
        }
        if (request.isBase() && !existing.isBase()) {
            makeBase(id);
        }
        if (existing.getRate().compareTo(request.getRate()) != 0) {
            // cached account totals are priced at the old rate
            balanceLedger.recomputeAccountsHolding(id);
        }
        return get(id);
    }

    /**
     * Makes {@code id} the single base currency.
     */
    @Transactional
    public Currency setBase(long id) {
        get(id);
        makeBase(id);
        log.info("Base currency set: id={}", id);
        return get(id);
    }

    @Transactional
    public void delete(long id) {
        Currency existing = get(id);
        if (currencyRepository.countReferences(id) > 0
            || currencyRepository.countNameReferences(existing.getName()) > 0) {
            throw new ReferentialConflictException("Currency is in use and cannot be deleted");
        }
        currencyRepository.delete(id);
    }

    @Transactional(readOnly = true)
    public Currency get(long id) {
        return currencyRepository.findById(id)
            .orElseThrow(() -> NotFoundException.of("Currency", id));
    }

    @Transactional(readOnly = true)
    public List<Currency> list() {
        return currencyRepository.findAll();
    }

    /**
     * Resolves a currency by exact name, as money-moving operations do.
     *
     * @throws CurrencyNotFoundException if no currency has that name
     */
    @Transactional(readOnly = true)
    public Currency requireByName(String name) {
        if (name == null) {
            throw new CurrencyNotFoundException("null");
        }
        return currencyRepository.findByName(name)
            .orElseThrow(() -> new CurrencyNotFoundException(name));
    }

    @Transactional(readOnly = true)
    public Optional<Currency> findBase() {
        return currencyRepository.findBase();
    }

    @Transactional
    public ExchangeRate createExchangeRate(ExchangeRateRequest request) {
        get(request.getFromCurrencyId());
        get(request.getToCurrencyId());
        long id = currencyRepository.insertExchangeRate(
            request.getFromCurrencyId(), request.getToCurrencyId(), request.getRate(), request.getDate());
        return ExchangeRate.builder()
            .id(id)
            .fromCurrencyId(request.getFromCurrencyId())
            .toCurrencyId(request.getToCurrencyId())
            .rate(request.getRate())
            .date(request.getDate())
            .build();
    }

    /**
     * Rate for the pair as of {@code date}. The identity pair is always 1.
     */
    @Transactional(readOnly = true)
    public BigDecimal getExchangeRate(long fromCurrencyId, long toCurrencyId, LocalDate date) {
        if (fromCurrencyId == toCurrencyId) {
            return BigDecimal.ONE;
        }
        return currencyRepository.findLatestRate(fromCurrencyId, toCurrencyId, date)
            .map(ExchangeRate::getRate)
            .orElseThrow(() -> new NotFoundException(
                "No exchange rate from currency " + fromCurrencyId + " to " + toCurrencyId + " on or before " + date));
    }

    @Transactional(readOnly = true)
    public List<ExchangeRate> getExchangeRateHistory(long fromCurrencyId, long toCurrencyId) {
        return currencyRepository.findRateHistory(fromCurrencyId, toCurrencyId);
    }

    private void makeBase(long id) {
        currencyRepository.clearBaseExcept(id);
        currencyRepository.markBase(id);
    }

    private String normalizeName(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationFailedException("Currency name is required");
        }
        return name.trim();
    }
}
