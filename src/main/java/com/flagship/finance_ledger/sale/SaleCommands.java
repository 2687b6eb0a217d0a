package com.flagship.finance_ledger.sale;

import com.flagship.finance_ledger.command.CommandHandler;
import com.flagship.finance_ledger.command.CommandModule;
import com.flagship.finance_ledger.sale.dto.SaleAdditionalCostRequest;
import com.flagship.finance_ledger.sale.dto.SaleItemRequest;
import com.flagship.finance_ledger.sale.dto.SalePaymentRequest;
import com.flagship.finance_ledger.sale.dto.SaleRequest;
import com.flagship.finance_ledger.sale.dto.SaleServiceItemRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class SaleCommands implements CommandModule {

    private final SaleService saleService;
    private final SaleItemService saleItemService;
    private final SalePaymentService salePaymentService;

    @Override
    public Map<String, CommandHandler> commands() {
        Map<String, CommandHandler> commands = new LinkedHashMap<>();
        commands.put("create_sale", p -> saleService.create(p.as(SaleRequest.class)));
        commands.put("update_sale", p -> saleService.update(p.id("id"), p.as(SaleRequest.class)));
        commands.put("delete_sale", p -> {
            saleService.delete(p.id("id"));
            return CommandHandler.message("Sale deleted");
        });
        commands.put("get_sale", p -> saleService.get(p.id("id")));
        commands.put("get_sales", p -> saleService.list(p.page()));
        commands.put("recompute_sale_totals", p -> saleItemService.recompute(p.id("id")));

        commands.put("create_sale_item", p -> saleItemService.createItem(p.as(SaleItemRequest.class)));
        commands.put("update_sale_item", p -> saleItemService.updateItem(p.id("id"), p.as(SaleItemRequest.class)));
        commands.put("delete_sale_item", p -> {
            saleItemService.deleteItem(p.id("id"));
            return CommandHandler.message("Sale item deleted");
        });
        commands.put("get_sale_items", p -> saleItemService.getItems(p.id("sale_id")));

        commands.put("create_sale_service_item", p ->
            saleItemService.createServiceItem(p.as(SaleServiceItemRequest.class)));
        commands.put("update_sale_service_item", p ->
            saleItemService.updateServiceItem(p.id("id"), p.as(SaleServiceItemRequest.class)));
        commands.put("delete_sale_service_item", p -> {
            saleItemService.deleteServiceItem(p.id("id"));
            return CommandHandler.message("Sale service item deleted");
        });
        commands.put("get_sale_service_items", p -> saleItemService.getServiceItems(p.id("sale_id")));

        commands.put("create_sale_additional_cost", p ->
            saleItemService.createAdditionalCost(p.as(SaleAdditionalCostRequest.class)));
        commands.put("update_sale_additional_cost", p ->
            saleItemService.updateAdditionalCost(p.id("id"), p.as(SaleAdditionalCostRequest.class)));
        commands.put("delete_sale_additional_cost", p -> {
            saleItemService.deleteAdditionalCost(p.id("id"));
            return CommandHandler.message("Sale additional cost deleted");
        });
        commands.put("get_sale_additional_costs", p -> saleItemService.getAdditionalCosts(p.id("sale_id")));

        commands.put("create_sale_payment", p -> salePaymentService.create(p.as(SalePaymentRequest.class)));
        commands.put("delete_sale_payment", p -> {
            salePaymentService.delete(p.id("id"));
            return CommandHandler.message("Sale payment deleted");
        });
        commands.put("get_sale_payments", p -> salePaymentService.getPayments(p.id("sale_id")));
        return commands;
    }
}
