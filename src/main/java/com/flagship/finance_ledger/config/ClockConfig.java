package com.flagship.finance_ledger.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Supplies "today" for discount-code validity windows and for exchange-rate
 * lookups made without a date. Every other date is provided by the caller.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock() {
        return Clock.system(ZoneId.systemDefault());
    }
}
