package com.flagship.finance_ledger.exception;

/**
 * A currency name did not resolve during a money-moving operation.
 */
public class CurrencyNotFoundException extends NotFoundException {

    public CurrencyNotFoundException(String currencyName) {
        super(ErrorCode.CURRENCY_NOT_FOUND, "Currency not found: " + currencyName);
    }
}
