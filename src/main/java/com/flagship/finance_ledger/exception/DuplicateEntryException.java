package com.flagship.finance_ledger.exception;

/**
 * A unique constraint was violated. Raised in place of the raw
 * constraint error so the caller gets a readable message.
 */
public class DuplicateEntryException extends FinanceException {

    public DuplicateEntryException(String message) {
        super(ErrorCode.DUPLICATE_KEY, message);
    }

    public DuplicateEntryException(String message, Throwable cause) {
        super(ErrorCode.DUPLICATE_KEY, message, cause);
    }
}
