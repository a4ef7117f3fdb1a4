package com.flagship.token_ledger.ledger;

/**
 * Failure kinds a ledger operation can report.
 */
public enum LedgerErrorCode {
    /**
     * Caller lacks the owner role.
     */
    UNAUTHORIZED,

    /**
     * Amount is zero or outside the token's numeric domain.
     */
    INVALID_AMOUNT,

    /**
     * Debit exceeds the caller's current balance.
     */
    INSUFFICIENT_BALANCE,

    /**
     * Result would exceed the largest representable amount.
     */
    OVERFLOW,

    /**
     * Transfer names the caller as its own recipient.
     */
    SAME_ACCOUNT
}
