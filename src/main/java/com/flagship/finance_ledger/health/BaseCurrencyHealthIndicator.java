package com.flagship.finance_ledger.health;

import com.flagship.finance_ledger.currency.Currency;
import com.flagship.finance_ledger.currency.CurrencyService;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Reports whether a base currency is configured. Without one, sale payments
 * that carry no currency cannot be recorded, so the state is "DEGRADED"
 * rather than down.
 */
@Component("baseCurrencyHealth")
public class BaseCurrencyHealthIndicator implements HealthIndicator {

    private final CurrencyService currencyService;

    public BaseCurrencyHealthIndicator(CurrencyService currencyService) {
        this.currencyService = currencyService;
    }

    @Override
    public Health health() {
        try {
            Optional<Currency> base = currencyService.findBase();
            if (base.isEmpty()) {
                return Health.status("DEGRADED")
                        .withDetail("error", "No base currency configured")
                        .build();
            }
            return Health.up()
                    .withDetail("baseCurrency", base.get().getName())
                    .build();
        } catch (Exception e) {
            return Health.down()
                    .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                    .build();
        }
    }
}
