package com.flagship.finance_ledger.coa;

import com.flagship.finance_ledger.coa.dto.CoaCategoryRequest;
import com.flagship.finance_ledger.command.CommandHandler;
import com.flagship.finance_ledger.command.CommandModule;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class CoaCategoryCommands implements CommandModule {

    private final CoaCategoryService coaCategoryService;

    @Override
    public Map<String, CommandHandler> commands() {
        Map<String, CommandHandler> commands = new LinkedHashMap<>();
        commands.put("create_coa_category", p -> coaCategoryService.create(p.as(CoaCategoryRequest.class)));
        commands.put("update_coa_category", p ->
            coaCategoryService.update(p.id("id"), p.as(CoaCategoryRequest.class)));
        commands.put("delete_coa_category", p -> {
            coaCategoryService.delete(p.id("id"));
            return CommandHandler.message("COA category deleted");
        });
        commands.put("get_coa_category", p -> coaCategoryService.get(p.id("id")));
        commands.put("get_coa_categories", p -> coaCategoryService.list());
        commands.put("get_coa_category_tree", p -> coaCategoryService.tree());
        commands.put("init_standard_coa_categories", p -> {
            int created = coaCategoryService.initStandardCategories();
            return CommandHandler.message("Standard COA categories initialized: " + created + " created");
        });
        return commands;
    }
}
