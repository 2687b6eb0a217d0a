package com.flagship.finance_ledger.currency;

import com.flagship.finance_ledger.command.CommandHandler;
import com.flagship.finance_ledger.command.CommandModule;
import com.flagship.finance_ledger.currency.dto.CurrencyRequest;
import com.flagship.finance_ledger.currency.dto.ExchangeRateRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class CurrencyCommands implements CommandModule {

    private final CurrencyService currencyService;
    private final Clock clock;

    @Override
    public Map<String, CommandHandler> commands() {
        Map<String, CommandHandler> commands = new LinkedHashMap<>();
        commands.put("create_currency", p -> currencyService.create(p.as(CurrencyRequest.class)));
        commands.put("update_currency", p -> currencyService.update(p.id("id"), p.as(CurrencyRequest.class)));
        commands.put("set_base_currency", p -> currencyService.setBase(p.id("id")));
        commands.put("delete_currency", p -> {
            currencyService.delete(p.id("id"));
            return CommandHandler.message("Currency deleted");
        });
        commands.put("get_currency", p -> currencyService.get(p.id("id")));
        commands.put("get_currencies", p -> currencyService.list());

        commands.put("create_exchange_rate", p -> currencyService.createExchangeRate(p.as(ExchangeRateRequest.class)));
        commands.put("get_exchange_rate", p -> {
            LocalDate date = p.text("date").isPresent() ? p.date("date") : LocalDate.now(clock);
            return currencyService.getExchangeRate(p.id("from_currency_id"), p.id("to_currency_id"), date);
        });
        commands.put("get_exchange_rate_history", p ->
            currencyService.getExchangeRateHistory(p.id("from_currency_id"), p.id("to_currency_id")));
        return commands;
    }
}
