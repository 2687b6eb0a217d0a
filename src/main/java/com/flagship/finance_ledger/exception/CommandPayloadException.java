package com.flagship.finance_ledger.exception;

import lombok.Getter;

import java.util.Map;

/**
 * A command payload could not be read into its request type, or failed
 * bean validation. Carries per-field messages when available.
 */
@Getter
public class CommandPayloadException extends RuntimeException {

    private final Map<String, String> details;

    public CommandPayloadException(String message, Map<String, String> details) {
        super(message);
        this.details = details;
    }

    public CommandPayloadException(String message, Throwable cause) {
        super(message, cause);
        this.details = Map.of();
    }
}
