package com.flagship.finance_ledger.journal;

import com.flagship.finance_ledger.common.Money;
import com.flagship.finance_ledger.common.PageQuery;
import com.flagship.finance_ledger.common.PagedResult;
import com.flagship.finance_ledger.currency.CurrencyService;
import com.flagship.finance_ledger.exception.NotFoundException;
import com.flagship.finance_ledger.exception.ValidationFailedException;
import com.flagship.finance_ledger.journal.dto.JournalEntryRequest;
import com.flagship.finance_ledger.journal.dto.JournalLineInput;
import com.flagship.finance_ledger.ledger.BalanceLedger;
import com.flagship.finance_ledger.observability.LedgerMetrics;
import com.flagship.finance_ledger.sequence.DocumentNumberGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Journal entries. Each line moves its (account, currency) balance by
 * +debit &minus; credit through {@link BalanceLedger}; no audit transaction
 * rows are written. Debits and credits are not required to balance.
 *
 * Update and delete first undo the stored lines' effect, so an entry's net
 * contribution to any balance is always exactly its current lines.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JournalEntryService {

    private final JournalEntryRepository journalEntryRepository;
    private final BalanceLedger balanceLedger;
    private final CurrencyService currencyService;
    private final DocumentNumberGenerator documentNumberGenerator;
    private final LedgerMetrics ledgerMetrics;

    @Transactional
    public JournalEntryDetail create(JournalEntryRequest request) {
        validate(request);
        lockAccounts(accountsOf(request), Set.of());

        String entryNumber = documentNumberGenerator.nextJournalEntryNumber();
        long entryId = journalEntryRepository.insert(JournalEntry.builder()
            .entryNumber(entryNumber)
            .entryDate(request.getEntryDate())
            .description(request.getDescription())
            .referenceType(request.getReferenceType())
            .referenceId(request.getReferenceId())
            .build());

        Set<Long> touched = applyLines(entryId, request.getLines());
        touched.forEach(balanceLedger::recomputeCurrentBalance);

        ledgerMetrics.incrementJournalEntriesCreated();
        log.info("Journal entry created: id={}, number={}, lines={}", entryId, entryNumber, request.getLines().size());
        return get(entryId);
    }

    @Transactional
    public JournalEntryDetail update(long entryId, JournalEntryRequest request) {
        lockEntry(entryId);
        validate(request);

        List<JournalEntryLine> oldLines = journalEntryRepository.findLines(entryId);
        Set<Long> touched = lockAccounts(accountsOf(request), accountsOf(oldLines));

        reverseLines(oldLines);
        journalEntryRepository.deleteLines(entryId);
        journalEntryRepository.updateHeader(JournalEntry.builder()
            .id(entryId)
            .entryDate(request.getEntryDate())
            .description(request.getDescription())
            .referenceType(request.getReferenceType())
            .referenceId(request.getReferenceId())
            .build());
        applyLines(entryId, request.getLines());
        touched.forEach(balanceLedger::recomputeCurrentBalance);

        log.info("Journal entry updated: id={}, oldLines={}, newLines={}", entryId, oldLines.size(),
            request.getLines().size());
        return get(entryId);
    }

    @Transactional
    public void delete(long entryId) {
        lockEntry(entryId);
        List<JournalEntryLine> oldLines = journalEntryRepository.findLines(entryId);
        Set<Long> touched = lockAccounts(Set.of(), accountsOf(oldLines));
        reverseLines(oldLines);
        journalEntryRepository.delete(entryId);
        touched.forEach(balanceLedger::recomputeCurrentBalance);
        log.info("Journal entry deleted: id={}, lines={}", entryId, oldLines.size());
    }

    @Transactional(readOnly = true)
    public JournalEntryDetail get(long entryId) {
        JournalEntry entry = journalEntryRepository.findById(entryId)
            .orElseThrow(() -> NotFoundException.of("Journal entry", entryId));
        return new JournalEntryDetail(entry, journalEntryRepository.findLines(entryId));
    }

    @Transactional(readOnly = true)
    public PagedResult<JournalEntry> list(PageQuery query) {
        return PagedResult.of(journalEntryRepository.findPage(query), journalEntryRepository.count(query), query);
    }

    private Set<Long> applyLines(long entryId, List<JournalLineInput> lines) {
        Set<Long> touched = new TreeSet<>();
        for (JournalLineInput input : lines) {
            JournalEntryLine line = toLine(entryId, input);
            journalEntryRepository.insertLine(line);
            balanceLedger.applyDelta(line.getAccountId(), line.getCurrencyId(), line.delta());
            touched.add(line.getAccountId());
        }
        return touched;
    }

    private void reverseLines(List<JournalEntryLine> lines) {
        for (JournalEntryLine line : lines) {
            balanceLedger.applyDelta(line.getAccountId(), line.getCurrencyId(), line.delta().negate());
        }
    }

    /**
     * Locks every account the operation touches, ascending by id, and returns
     * them for the final recompute.
     */
    private Set<Long> lockAccounts(Set<Long> newAccounts, Set<Long> oldAccounts) {
        Set<Long> accounts = new TreeSet<>(newAccounts);
        accounts.addAll(oldAccounts);
        accounts.forEach(balanceLedger::lockAccount);
        return accounts;
    }

    private void validate(JournalEntryRequest request) {
        if (request.getEntryDate() == null) {
            throw new ValidationFailedException("Entry date is required");
        }
        if (request.getLines().isEmpty()) {
            throw new ValidationFailedException("Journal entry must have at least one line");
        }
        for (JournalLineInput line : request.getLines()) {
            if (line.getAccountId() == null || line.getCurrencyId() == null) {
                throw new ValidationFailedException("Journal line requires an account and a currency");
            }
            BigDecimal debit = Money.orZero(line.getDebitAmount());
            BigDecimal credit = Money.orZero(line.getCreditAmount());
            if (debit.signum() < 0 || credit.signum() < 0) {
                throw new ValidationFailedException("Debit and credit cannot be negative");
            }
            if (debit.signum() > 0 && credit.signum() > 0) {
                throw new ValidationFailedException("A journal line cannot have both a debit and a credit");
            }
            if (debit.signum() == 0 && credit.signum() == 0) {
                throw new ValidationFailedException("A journal line needs a debit or a credit amount");
            }
            currencyService.get(line.getCurrencyId());
        }
    }

    private static JournalEntryLine toLine(long entryId, JournalLineInput input) {
        BigDecimal debit = Money.orZero(input.getDebitAmount());
        BigDecimal credit = Money.orZero(input.getCreditAmount());
        BigDecimal rate = Money.orOne(input.getExchangeRate());
        BigDecimal side = debit.signum() > 0 ? debit : credit;
        return JournalEntryLine.builder()
            .journalEntryId(entryId)
            .accountId(input.getAccountId())
            .currencyId(input.getCurrencyId())
            .debitAmount(debit)
            .creditAmount(credit)
            .exchangeRate(rate)
            .baseAmount(Money.round6(side.multiply(rate)))
            .description(input.getDescription())
            .build();
    }

    private static Set<Long> accountsOf(JournalEntryRequest request) {
        Set<Long> accounts = new TreeSet<>();
        request.getLines().forEach(line -> accounts.add(line.getAccountId()));
        return accounts;
    }

    private static Set<Long> accountsOf(List<JournalEntryLine> lines) {
        Set<Long> accounts = new TreeSet<>();
        lines.forEach(line -> accounts.add(line.getAccountId()));
        return accounts;
    }

    private void lockEntry(long entryId) {
        if (!journalEntryRepository.lock(entryId)) {
            throw NotFoundException.of("Journal entry", entryId);
        }
    }
}
