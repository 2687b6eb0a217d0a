package com.flagship.finance_ledger.exception;

public class NotFoundException extends FinanceException {

    public NotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }

    protected NotFoundException(ErrorCode code, String message) {
        super(code, message);
    }

    public static NotFoundException of(String entity, Object id) {
        return new NotFoundException(entity + " not found: " + id);
    }
}
