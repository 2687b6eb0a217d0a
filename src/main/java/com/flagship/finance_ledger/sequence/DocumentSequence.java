package com.flagship.finance_ledger.sequence;

/**
 * Named counters behind generated document numbers. Each counter is seeded
 * on first use from the largest numeric suffix already present, so numbering
 * continues across existing data.
 */
public enum DocumentSequence {

    BATCH("batch", "BATCH-%06d",
        "SELECT COALESCE(MAX(CAST(SUBSTRING(batch_number FROM 7) AS BIGINT)), 0) " +
        "FROM purchases WHERE batch_number ~ '^BATCH-[0-9]+$'"),

    JOURNAL_ENTRY("journal_entry", "J%06d",
        "SELECT COALESCE(MAX(CAST(SUBSTRING(entry_number FROM 2) AS BIGINT)), 0) " +
        "FROM journal_entries WHERE entry_number ~ '^J[0-9]+$'");

    private final String key;
    private final String format;
    private final String maxExistingSql;

    DocumentSequence(String key, String format, String maxExistingSql) {
        this.key = key;
        this.format = format;
        this.maxExistingSql = maxExistingSql;
    }

    public String getKey() {
        return key;
    }

    public String getMaxExistingSql() {
        return maxExistingSql;
    }

    public String format(long value) {
        return String.format(format, value);
    }
}
