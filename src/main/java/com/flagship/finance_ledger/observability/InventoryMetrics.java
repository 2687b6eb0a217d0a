package com.flagship.finance_ledger.observability;

import com.flagship.finance_ledger.inventory.BatchRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Inventory gauges:
 * - inventory.batches.open: batches with remaining stock
 * - inventory.stock.value: &Sigma; remaining &times; cost price over open batches
 *
 * Values are cached and refreshed by {@link MetricsScheduler} so scrapes do
 * not query the database.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InventoryMetrics {

    private final BatchRepository batchRepository;
    private final MeterRegistry meterRegistry;

    private final AtomicLong openBatches = new AtomicLong(0);
    private final AtomicReference<BigDecimal> stockValue = new AtomicReference<>(BigDecimal.ZERO);

    @PostConstruct
    public void init() {
        Gauge.builder("inventory.batches.open", openBatches, AtomicLong::get)
                .description("Number of batches with remaining stock")
                .register(meterRegistry);

        Gauge.builder("inventory.stock.value", stockValue, value -> value.get().doubleValue())
                .description("Cost value of the remaining stock")
                .register(meterRegistry);

        log.info("Inventory metrics registered with Micrometer");
    }

    /**
     * Refreshes the cached values in one read-only transaction.
     */
    @Transactional(readOnly = true)
    public void refreshMetrics() {
        try {
            long open = batchRepository.countOpenBatches();
            openBatches.set(open);

            BigDecimal value = batchRepository.totalStockValue();
            stockValue.set(value != null ? value : BigDecimal.ZERO);

            log.debug("Inventory metrics refreshed: openBatches={}, stockValue={}", open, stockValue.get());
        } catch (Exception e) {
            log.warn("Failed to refresh inventory metrics: {}", e.getMessage());
        }
    }
}
