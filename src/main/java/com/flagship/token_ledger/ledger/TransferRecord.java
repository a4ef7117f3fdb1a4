package com.flagship.token_ledger.ledger;

import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Immutable entry in the transfer log.
 *
 * A null {@code from} marks a mint, a null {@code to} marks a burn.
 */
@Value
public class TransferRecord {
    long sequenceNumber;
    Principal from;
    Principal to;
    BigInteger amount;
    Instant timestamp;

    public boolean isMint() {
        return from == null;
    }

    public boolean isBurn() {
        return to == null;
    }
}
