package com.flagship.token_ledger.ledger;

/**
 * Closed set of mutating ledger operations.
 */
public enum LedgerOperation {
    CREATE_WALLET,
    MINT,
    TRANSFER,
    BURN,
    CHANGE_OWNER;

    /**
     * Whether a successful run of this operation appends to the transfer log.
     */
    public boolean isLogged() {
        return switch (this) {
            case MINT, TRANSFER, BURN -> true;
            case CREATE_WALLET, CHANGE_OWNER -> false;
        };
    }

    /**
     * Lowercase name used in log lines and metric tags.
     */
    public String tagName() {
        return name().toLowerCase();
    }
}
