package com.flagship.finance_ledger.journal.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.util.List;

/**
 * Create or full-replace request for a journal entry. Debits and credits
 * are not required to balance.
 */
@Value
@Builder
@Jacksonized
public class JournalEntryRequest {

    @NotNull(message = "Entry date is required")
    LocalDate entryDate;

    String description;

    String referenceType;

    Long referenceId;

    @Valid
    @NotEmpty(message = "Journal entry must have at least one line")
    List<JournalLineInput> lines;

    public List<JournalLineInput> getLines() {
        return lines != null ? lines : List.of();
    }
}
