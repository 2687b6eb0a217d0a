package com.flagship.finance_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Centralized metrics for ledger and inventory operations.
 *
 * Metrics exposed:
 * - ledger.sales.created, ledger.purchases.created, ledger.journal_entries.created
 * - ledger.balance.movements{kind, currency}: deposits and withdrawals applied to accounts
 * - ledger.checks.rejected{check}: stock or funds checks that blocked an operation
 * - ledger.command.duration{command}: time spent handling one command
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    private final Counter salesCreated;
    private final Counter purchasesCreated;
    private final Counter journalEntriesCreated;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.salesCreated = Counter.builder("ledger.sales.created")
                .description("Number of sales created")
                .register(registry);

        this.purchasesCreated = Counter.builder("ledger.purchases.created")
                .description("Number of purchases created")
                .register(registry);

        this.journalEntriesCreated = Counter.builder("ledger.journal_entries.created")
                .description("Number of journal entries created")
                .register(registry);
    }

    public void incrementSalesCreated() {
        salesCreated.increment();
    }

    public void incrementPurchasesCreated() {
        purchasesCreated.increment();
    }

    public void incrementJournalEntriesCreated() {
        journalEntriesCreated.increment();
    }

    /**
     * Records a deposit or withdrawal applied to an account.
     * Uses registry.counter() for efficient meter lookup/creation.
     */
    public void recordBalanceMovement(String kind, String currency) {
        registry.counter("ledger.balance.movements",
                "kind", sanitizeTag(kind),
                "currency", sanitizeTag(currency)
        ).increment();
    }

    /**
     * Records a stock or funds check that rejected an operation.
     */
    public void recordRejectedCheck(String check) {
        registry.counter("ledger.checks.rejected", "check", sanitizeTag(check)).increment();
    }

    /**
     * Times one command, tagged by its name and outcome.
     */
    public <T> T timeCommand(String command, Supplier<T> operation) {
        Timer.Sample sample = Timer.start(registry);
        String outcome = "error";
        try {
            T result = operation.get();
            outcome = "success";
            return result;
        } finally {
            sample.stop(registry.timer("ledger.command.duration",
                    "command", sanitizeTag(command),
                    "outcome", outcome));
        }
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
