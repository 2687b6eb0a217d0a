package com.flagship.finance_ledger.exception;

/**
 * A delete was blocked because dependent rows still exist.
 */
public class ReferentialConflictException extends FinanceException {

    public ReferentialConflictException(String message) {
        super(ErrorCode.REFERENTIAL_CONFLICT, message);
    }
}
