package com.flagship.finance_ledger.inventory;

import com.flagship.finance_ledger.command.CommandHandler;
import com.flagship.finance_ledger.command.CommandModule;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class InventoryCommands implements CommandModule {

    private final BatchInventoryLedger batchInventoryLedger;

    @Override
    public Map<String, CommandHandler> commands() {
        Map<String, CommandHandler> commands = new LinkedHashMap<>();
        commands.put("get_product_batches", p -> batchInventoryLedger.getProductBatches(p.id("product_id")));
        commands.put("get_product_stock", p ->
            batchInventoryLedger.getProductStock(p.id("product_id"), p.optionalLong("unit_id").orElse(null)));
        commands.put("get_stock_by_batches", p -> batchInventoryLedger.getStockByBatches());
        return commands;
    }
}
