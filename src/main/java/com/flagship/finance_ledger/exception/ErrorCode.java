package com.flagship.finance_ledger.exception;

import org.springframework.http.HttpStatus;

/**
 * Error taxonomy reported at the API boundary.
 */
public enum ErrorCode {
    NOT_FOUND(HttpStatus.NOT_FOUND),
    CURRENCY_NOT_FOUND(HttpStatus.NOT_FOUND),
    VALIDATION_FAILED(HttpStatus.BAD_REQUEST),
    INSUFFICIENT_STOCK(HttpStatus.CONFLICT),
    INSUFFICIENT_FUNDS(HttpStatus.CONFLICT),
    REFERENTIAL_CONFLICT(HttpStatus.CONFLICT),
    DUPLICATE_KEY(HttpStatus.CONFLICT);

    private final HttpStatus status;

    ErrorCode(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
