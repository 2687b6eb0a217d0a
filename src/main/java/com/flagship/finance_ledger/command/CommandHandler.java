package com.flagship.finance_ledger.command;

import java.util.Map;

/**
 * One named operation reachable through the invoke endpoint.
 */
@FunctionalInterface
public interface CommandHandler {

    Object handle(CommandPayload payload);

    static Map<String, String> message(String text) {
        return Map.of("message", text);
    }
}
