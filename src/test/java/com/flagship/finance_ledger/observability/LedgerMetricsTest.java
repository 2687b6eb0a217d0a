package com.flagship.finance_ledger.observability;

import com.flagship.finance_ledger.inventory.BatchRepository;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class LedgerMetricsTest {

    private MeterRegistry registry;
    private LedgerMetrics ledgerMetrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        ledgerMetrics = new LedgerMetrics(registry);
    }

    @Test
    @DisplayName("Command timer is tagged with the outcome")
    void commandOutcomeTags() {
        assertEquals("ok", ledgerMetrics.timeCommand("get_units", () -> "ok"));
        assertThrows(IllegalStateException.class, () -> ledgerMetrics.timeCommand("get_units", () -> {
            throw new IllegalStateException("boom");
        }));

        Timer success = registry.find("ledger.command.duration").tags("command", "get_units", "outcome", "success").timer();
        Timer error = registry.find("ledger.command.duration").tags("command", "get_units", "outcome", "error").timer();
        assertNotNull(success);
        assertNotNull(error);
        assertEquals(1, success.count());
        assertEquals(1, error.count());
    }

    @Test
    @DisplayName("Tag values are sanitized and null becomes unknown")
    void tagSanitizing() {
        ledgerMetrics.recordBalanceMovement("deposit", "US$");
        ledgerMetrics.recordRejectedCheck(null);

        assertEquals(1.0, registry.counter("ledger.balance.movements", "kind", "deposit", "currency", "US_").count());
        assertEquals(1.0, registry.counter("ledger.checks.rejected", "check", "unknown").count());
    }

    @Test
    @DisplayName("Inventory gauges show the last refreshed values and keep them when a refresh fails")
    void inventoryGauges() {
        BatchRepository batchRepository = mock(BatchRepository.class);
        InventoryMetrics inventoryMetrics = new InventoryMetrics(batchRepository, registry);
        inventoryMetrics.init();
        when(batchRepository.countOpenBatches()).thenReturn(4L);
        when(batchRepository.totalStockValue()).thenReturn(new BigDecimal("250.5"));

        inventoryMetrics.refreshMetrics();

        assertEquals(4.0, registry.get("inventory.batches.open").gauge().value());
        assertEquals(250.5, registry.get("inventory.stock.value").gauge().value());

        doThrow(new IllegalStateException("db down")).when(batchRepository).countOpenBatches();
        inventoryMetrics.refreshMetrics();

        assertEquals(4.0, registry.get("inventory.batches.open").gauge().value());
    }
}
