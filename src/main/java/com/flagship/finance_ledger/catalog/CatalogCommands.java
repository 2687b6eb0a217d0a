package com.flagship.finance_ledger.catalog;

import com.flagship.finance_ledger.catalog.dto.PartyRequest;
import com.flagship.finance_ledger.catalog.dto.ProductRequest;
import com.flagship.finance_ledger.catalog.dto.ServiceRequest;
import com.flagship.finance_ledger.command.CommandHandler;
import com.flagship.finance_ledger.command.CommandModule;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Suppliers, customers, products and services.
 */
@Component
@RequiredArgsConstructor
public class CatalogCommands implements CommandModule {

    private final CatalogService catalogService;

    @Override
    public Map<String, CommandHandler> commands() {
        Map<String, CommandHandler> commands = new LinkedHashMap<>();
        for (PartyKind kind : PartyKind.values()) {
            registerParty(commands, kind);
        }

        commands.put("create_product", p -> catalogService.createProduct(p.as(ProductRequest.class)));
        commands.put("update_product", p -> catalogService.updateProduct(p.id("id"), p.as(ProductRequest.class)));
        commands.put("delete_product", p -> {
            catalogService.deleteProduct(p.id("id"));
            return CommandHandler.message("Product deleted");
        });
        commands.put("get_product", p -> catalogService.requireProduct(p.id("id")));
        commands.put("get_products", p -> catalogService.listProducts(p.text("search").orElse(null)));

        commands.put("create_service", p -> catalogService.createService(p.as(ServiceRequest.class)));
        commands.put("update_service", p -> catalogService.updateService(p.id("id"), p.as(ServiceRequest.class)));
        commands.put("delete_service", p -> {
            catalogService.deleteService(p.id("id"));
            return CommandHandler.message("Service deleted");
        });
        commands.put("get_service", p -> catalogService.requireService(p.id("id")));
        commands.put("get_services", p -> catalogService.listServices());
        return commands;
    }

    private void registerParty(Map<String, CommandHandler> commands, PartyKind kind) {
        String singular = kind.name().toLowerCase(Locale.ROOT);
        commands.put("create_" + singular, p -> catalogService.createParty(kind, p.as(PartyRequest.class)));
        commands.put("update_" + singular, p ->
            catalogService.updateParty(kind, p.id("id"), p.as(PartyRequest.class)));
        commands.put("delete_" + singular, p -> {
            catalogService.deleteParty(kind, p.id("id"));
            return CommandHandler.message(kind.label() + " deleted");
        });
        commands.put("get_" + singular, p -> catalogService.requireParty(kind, p.id("id")));
        commands.put("get_" + singular + "s", p -> catalogService.listParties(kind, p.text("search").orElse(null)));
    }
}
