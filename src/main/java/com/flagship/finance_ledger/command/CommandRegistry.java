package com.flagship.finance_ledger.command;

import com.flagship.finance_ledger.exception.ValidationFailedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Maps command names to handlers collected from every {@link CommandModule}.
 *
 * Two modules registering the same name is a wiring error and fails startup.
 */
@Component
@Slf4j
public class CommandRegistry {

    private final Map<String, CommandHandler> handlers;

    public CommandRegistry(List<CommandModule> modules) {
        Map<String, CommandHandler> table = new TreeMap<>();
        for (CommandModule module : modules) {
            module.commands().forEach((name, handler) -> {
                if (table.putIfAbsent(name, handler) != null) {
                    throw new IllegalStateException("Command registered twice: " + name);
                }
            });
        }
        this.handlers = Collections.unmodifiableMap(table);
        log.info("Registered {} commands from {} modules", handlers.size(), modules.size());
    }

    public Object dispatch(String command, CommandPayload payload) {
        CommandHandler handler = handlers.get(command);
        if (handler == null) {
            throw new ValidationFailedException("Unknown command: " + command);
        }
        return handler.handle(payload);
    }

    public Set<String> names() {
        return handlers.keySet();
    }
}
