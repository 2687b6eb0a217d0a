package com.flagship.finance_ledger.journal;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
public class JournalEntry {
    Long id;
    String entryNumber;
    LocalDate entryDate;
    String description;
    String referenceType;
    Long referenceId;
}
