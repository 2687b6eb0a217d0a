package com.flagship.finance_ledger.exception;

import lombok.Getter;

/**
 * Base class for every recoverable, user-reportable failure.
 * The message is shown to the end user verbatim.
 */
@Getter
public class FinanceException extends RuntimeException {

    private final ErrorCode code;

    public FinanceException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public FinanceException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}
