package com.flagship.finance_ledger.journal;

import lombok.Value;

import java.util.List;

@Value
public class JournalEntryDetail {
    JournalEntry entry;
    List<JournalEntryLine> lines;
}
