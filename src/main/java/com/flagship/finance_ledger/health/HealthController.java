package com.flagship.finance_ledger.health;

import com.flagship.finance_ledger.command.CommandRegistry;
import com.flagship.finance_ledger.currency.Currency;
import com.flagship.finance_ledger.currency.CurrencyService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Probe endpoint for the ledger service.
 *
 * DOWN (503) when the database is unreachable, DEGRADED when no base
 * currency is set, UP otherwise.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private final DataSource dataSource;
    private final CurrencyService currencyService;
    private final CommandRegistry commandRegistry;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("timestamp", Instant.now().toString());
        response.put("commands", commandRegistry.names().size());

        if (!databaseReachable()) {
            response.put("status", "DOWN");
            response.put("database", "DOWN");
            return ResponseEntity.status(503).body(response);
        }
        response.put("database", "UP");

        Optional<Currency> base = currencyService.findBase();
        response.put("base_currency", base.map(Currency::getName).orElse(null));
        response.put("status", base.isPresent() ? "UP" : "DEGRADED");
        return ResponseEntity.ok(response);
    }

    private boolean databaseReachable() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (SQLException e) {
            log.warn("Database check failed: {}", e.getMessage());
            return false;
        }
    }
}
