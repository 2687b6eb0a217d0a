package com.flagship.finance_ledger.exception;

public class InsufficientFundsException extends FinanceException {

    public InsufficientFundsException(String message) {
        super(ErrorCode.INSUFFICIENT_FUNDS, message);
    }
}
