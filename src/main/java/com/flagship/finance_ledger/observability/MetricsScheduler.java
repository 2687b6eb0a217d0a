package com.flagship.finance_ledger.observability;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically refreshes gauges that need database queries.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsScheduler {

    private final InventoryMetrics inventoryMetrics;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshInventoryMetrics() {
        inventoryMetrics.refreshMetrics();
    }
}
