package com.flagship.finance_ledger.purchase;

import com.flagship.finance_ledger.command.CommandHandler;
import com.flagship.finance_ledger.command.CommandModule;
import com.flagship.finance_ledger.purchase.dto.PurchaseAdditionalCostRequest;
import com.flagship.finance_ledger.purchase.dto.PurchaseItemRequest;
import com.flagship.finance_ledger.purchase.dto.PurchasePaymentRequest;
import com.flagship.finance_ledger.purchase.dto.PurchaseRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class PurchaseCommands implements CommandModule {

    private final PurchaseService purchaseService;
    private final PurchasePaymentService purchasePaymentService;

    @Override
    public Map<String, CommandHandler> commands() {
        Map<String, CommandHandler> commands = new LinkedHashMap<>();
        commands.put("create_purchase", p -> purchaseService.create(p.as(PurchaseRequest.class)));
        commands.put("update_purchase", p -> purchaseService.update(p.id("id"), p.as(PurchaseRequest.class)));
        commands.put("delete_purchase", p -> {
            purchaseService.delete(p.id("id"));
            return CommandHandler.message("Purchase deleted");
        });
        commands.put("get_purchase", p -> purchaseService.get(p.id("id")));
        commands.put("get_purchases", p -> purchaseService.list(p.page()));

        commands.put("create_purchase_item", p -> purchaseService.createItem(p.as(PurchaseItemRequest.class)));
        commands.put("update_purchase_item", p ->
            purchaseService.updateItem(p.id("id"), p.as(PurchaseItemRequest.class)));
        commands.put("delete_purchase_item", p -> {
            purchaseService.deleteItem(p.id("id"));
            return CommandHandler.message("Purchase item deleted");
        });
        commands.put("get_purchase_items", p -> purchaseService.getItems(p.id("purchase_id")));

        commands.put("create_purchase_additional_cost", p ->
            purchaseService.createAdditionalCost(p.as(PurchaseAdditionalCostRequest.class)));
        commands.put("update_purchase_additional_cost", p ->
            purchaseService.updateAdditionalCost(p.id("id"), p.as(PurchaseAdditionalCostRequest.class)));
        commands.put("delete_purchase_additional_cost", p -> {
            purchaseService.deleteAdditionalCost(p.id("id"));
            return CommandHandler.message("Purchase additional cost deleted");
        });
        commands.put("get_purchase_additional_costs", p -> purchaseService.getAdditionalCosts(p.id("purchase_id")));

        commands.put("create_purchase_payment", p ->
            purchasePaymentService.create(p.as(PurchasePaymentRequest.class)));
        commands.put("update_purchase_payment", p ->
            purchasePaymentService.update(p.id("id"), p.as(PurchasePaymentRequest.class)));
        commands.put("delete_purchase_payment", p -> {
            purchasePaymentService.delete(p.id("id"));
            return CommandHandler.message("Purchase payment deleted");
        });
        commands.put("get_purchase_payments_by_purchase", p ->
            purchasePaymentService.getPayments(p.id("purchase_id")));
        return commands;
    }
}
