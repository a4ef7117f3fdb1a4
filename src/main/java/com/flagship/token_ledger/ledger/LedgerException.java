package com.flagship.token_ledger.ledger;

import lombok.Getter;

/**
 * Typed rejection of a ledger operation.
 * Thrown before any state is touched, so a rejected operation never leaves a partial mutation.
 */
@Getter
public class LedgerException extends RuntimeException {

    private final LedgerErrorCode errorCode;

    public LedgerException(LedgerErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
