package com.flagship.finance_ledger.expense;

import com.flagship.finance_ledger.command.CommandHandler;
import com.flagship.finance_ledger.command.CommandModule;
import com.flagship.finance_ledger.expense.dto.ExpenseRequest;
import com.flagship.finance_ledger.expense.dto.ExpenseTypeRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class ExpenseCommands implements CommandModule {

    private final ExpenseService expenseService;

    @Override
    public Map<String, CommandHandler> commands() {
        Map<String, CommandHandler> commands = new LinkedHashMap<>();
        commands.put("create_expense_type", p -> expenseService.createType(p.as(ExpenseTypeRequest.class)));
        commands.put("update_expense_type", p ->
            expenseService.updateType(p.id("id"), p.as(ExpenseTypeRequest.class)));
        commands.put("delete_expense_type", p -> {
            expenseService.deleteType(p.id("id"));
            return CommandHandler.message("Expense type deleted");
        });
        commands.put("get_expense_type", p -> expenseService.getType(p.id("id")));
        commands.put("get_expense_types", p -> expenseService.listTypes());

        commands.put("create_expense", p -> expenseService.create(p.as(ExpenseRequest.class)));
        commands.put("update_expense", p -> expenseService.update(p.id("id"), p.as(ExpenseRequest.class)));
        commands.put("delete_expense", p -> {
            expenseService.delete(p.id("id"));
            return CommandHandler.message("Expense deleted");
        });
        commands.put("get_expense", p -> expenseService.get(p.id("id")));
        commands.put("get_expenses", p -> expenseService.list(p.page()));
        return commands;
    }
}
