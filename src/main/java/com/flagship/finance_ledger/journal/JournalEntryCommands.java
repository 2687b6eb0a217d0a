package com.flagship.finance_ledger.journal;

import com.flagship.finance_ledger.command.CommandHandler;
import com.flagship.finance_ledger.command.CommandModule;
import com.flagship.finance_ledger.journal.dto.JournalEntryRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class JournalEntryCommands implements CommandModule {

    private final JournalEntryService journalEntryService;

    @Override
    public Map<String, CommandHandler> commands() {
        Map<String, CommandHandler> commands = new LinkedHashMap<>();
        commands.put("create_journal_entry", p -> journalEntryService.create(p.as(JournalEntryRequest.class)));
        commands.put("update_journal_entry", p ->
            journalEntryService.update(p.id("id"), p.as(JournalEntryRequest.class)));
        commands.put("delete_journal_entry", p -> {
            journalEntryService.delete(p.id("id"));
            return CommandHandler.message("Journal entry deleted");
        });
        commands.put("get_journal_entry", p -> journalEntryService.get(p.id("id")));
        commands.put("get_journal_entries", p -> journalEntryService.list(p.page()));
        return commands;
    }
}
