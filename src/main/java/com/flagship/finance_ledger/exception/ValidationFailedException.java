package com.flagship.finance_ledger.exception;

public class ValidationFailedException extends FinanceException {

    public ValidationFailedException(String message) {
        super(ErrorCode.VALIDATION_FAILED, message);
    }
}
