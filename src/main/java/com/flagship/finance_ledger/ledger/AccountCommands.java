package com.flagship.finance_ledger.ledger;

import com.flagship.finance_ledger.command.CommandHandler;
import com.flagship.finance_ledger.command.CommandModule;
import com.flagship.finance_ledger.ledger.dto.AccountRequest;
import com.flagship.finance_ledger.ledger.dto.AccountTransactionRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class AccountCommands implements CommandModule {

    private final AccountService accountService;
    private final AccountTransactionService accountTransactionService;

    @Override
    public Map<String, CommandHandler> commands() {
        Map<String, CommandHandler> commands = new LinkedHashMap<>();
        commands.put("create_account", p -> accountService.create(p.as(AccountRequest.class)));
        commands.put("update_account", p -> accountService.update(p.id("id"), p.as(AccountRequest.class)));
        commands.put("delete_account", p -> {
            accountService.delete(p.id("id"));
            return CommandHandler.message("Account deleted");
        });
        commands.put("get_account", p -> accountService.get(p.id("id")));
        commands.put("get_accounts", p -> accountService.list());

        commands.put("get_account_balance", p -> accountService.get(p.id("account_id")).getCurrentBalance());
        commands.put("get_account_balance_by_currency", p ->
            accountService.getBalanceByCurrency(p.id("account_id"), p.id("currency_id")));
        commands.put("get_account_currency_balances", p -> accountService.getCurrencyBalances(p.id("account_id")));
        commands.put("get_all_account_balances", p -> accountService.getAllCurrencyBalances());
        commands.put("reconcile_account_balance", p ->
            accountService.reconcile(p.id("account_id"), p.id("currency_id")));

        commands.put("deposit_account", p ->
            accountTransactionService.deposit(p.as(AccountTransactionRequest.class)));
        commands.put("withdraw_account", p ->
            accountTransactionService.withdraw(p.as(AccountTransactionRequest.class)));
        commands.put("get_account_transactions", p -> accountTransactionService.getTransactions(p.id("account_id")));
        return commands;
    }
}
