package com.flagship.finance_ledger.journal;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One side of a journal entry. Moves its account's balance in
 * {@code currencyId} by debit &minus; credit.
 */
@Value
@Builder
public class JournalEntryLine {
    Long id;
    Long journalEntryId;
    Long accountId;
    Long currencyId;
    BigDecimal debitAmount;
    BigDecimal creditAmount;
    BigDecimal exchangeRate;
    BigDecimal baseAmount;
    String description;

    public BigDecimal delta() {
        return debitAmount.subtract(creditAmount);
    }
}
