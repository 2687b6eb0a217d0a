package com.flagship.finance_ledger.exception;

public class InsufficientStockException extends FinanceException {

    public InsufficientStockException(String message) {
        super(ErrorCode.INSUFFICIENT_STOCK, message);
    }
}
