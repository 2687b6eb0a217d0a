package com.flagship.finance_ledger.discount;

import com.flagship.finance_ledger.command.CommandHandler;
import com.flagship.finance_ledger.command.CommandModule;
import com.flagship.finance_ledger.discount.dto.DiscountCodeRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class DiscountCodeCommands implements CommandModule {

    private final DiscountCodeService discountCodeService;

    @Override
    public Map<String, CommandHandler> commands() {
        Map<String, CommandHandler> commands = new LinkedHashMap<>();
        commands.put("create_discount_code", p -> discountCodeService.create(p.as(DiscountCodeRequest.class)));
        commands.put("update_discount_code", p ->
            discountCodeService.update(p.id("id"), p.as(DiscountCodeRequest.class)));
        commands.put("delete_discount_code", p -> {
            discountCodeService.delete(p.id("id"));
            return CommandHandler.message("Discount code deleted");
        });
        commands.put("get_discount_code", p -> discountCodeService.get(p.id("id")));
        commands.put("get_discount_codes", p -> discountCodeService.list(p.text("search").orElse(null)));
        commands.put("validate_discount_code", p ->
            discountCodeService.validate(p.requiredText("code"), p.decimal("subtotal")));
        return commands;
    }
}
