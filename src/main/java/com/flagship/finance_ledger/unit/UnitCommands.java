package com.flagship.finance_ledger.unit;

import com.flagship.finance_ledger.command.CommandHandler;
import com.flagship.finance_ledger.command.CommandModule;
import com.flagship.finance_ledger.unit.dto.UnitRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class UnitCommands implements CommandModule {

    private final UnitService unitService;

    @Override
    public Map<String, CommandHandler> commands() {
        Map<String, CommandHandler> commands = new LinkedHashMap<>();
        commands.put("create_unit", p -> unitService.create(p.as(UnitRequest.class)));
        commands.put("update_unit", p -> unitService.update(p.id("id"), p.as(UnitRequest.class)));
        commands.put("delete_unit", p -> {
            unitService.delete(p.id("id"));
            return CommandHandler.message("Unit deleted");
        });
        commands.put("get_unit", p -> unitService.get(p.id("id")));
        commands.put("get_units", p -> unitService.list());
        commands.put("create_unit_group", p -> unitService.createGroup(p.requiredText("name")));
        commands.put("get_unit_groups", p -> unitService.listGroups());
        return commands;
    }
}
