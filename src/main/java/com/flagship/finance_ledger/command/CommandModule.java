package com.flagship.finance_ledger.command;

import java.util.Map;

/**
 * A feature's contribution to the command table.
 */
public interface CommandModule {

    Map<String, CommandHandler> commands();
}
