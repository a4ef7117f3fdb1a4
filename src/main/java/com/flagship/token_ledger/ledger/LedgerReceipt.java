package com.flagship.token_ledger.ledger;

import lombok.Value;

import java.util.Optional;

/**
 * Outcome of a successfully executed {@link LedgerCommand}.
 *
 * {@code changed} is false when the command was a no-op (wallet already
 * existed, owner unchanged). {@code record} is present for logged operations.
 */
@Value
public class LedgerReceipt {
    LedgerOperation operation;
    Principal caller;
    boolean changed;
    TransferRecord record;

    public Optional<TransferRecord> getRecord() {
        return Optional.ofNullable(record);
    }

    /**
     * @return The transfer record of a logged operation
     * @throws IllegalStateException if the operation produced no record
     */
    public TransferRecord requireRecord() {
        if (record == null) {
            throw new IllegalStateException("No transfer record produced by " + operation);
        }
        return record;
    }
}
