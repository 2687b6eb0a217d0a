package com.flagship.finance_ledger.sequence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Generates BATCH-NNNNNN and JNNNNNN numbers from atomic counters.
 *
 * The increment is a single upsert: the first call inserts max(existing)+1,
 * later calls bump last_value under the row lock the upsert takes, so two
 * concurrent callers never receive the same number.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DocumentNumberGenerator {

    private final JdbcTemplate jdbcTemplate;

    public String next(DocumentSequence sequence) {
        Long value = jdbcTemplate.queryForObject(
            "INSERT INTO document_sequences (name, last_value) " +
            "VALUES (?, (" + sequence.getMaxExistingSql() + ") + 1) " +
            "ON CONFLICT (name) DO UPDATE SET last_value = document_sequences.last_value + 1 " +
            "RETURNING last_value",
            Long.class,
            sequence.getKey());
        String number = sequence.format(value != null ? value : 1L);
        log.debug("Generated document number {}", number);
        return number;
    }

    public String nextBatchNumber() {
        return next(DocumentSequence.BATCH);
    }

    public String nextJournalEntryNumber() {
        return next(DocumentSequence.JOURNAL_ENTRY);
    }
}
