package com.flagship.token_ledger.ledger;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Opaque identity of a ledger participant.
 *
 * The ledger interprets nothing about a principal beyond equality. Callers are
 * authenticated upstream and arrive here already identified.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Principal {

    public static final int MAX_LENGTH = 128;

    String id;

    public static Principal of(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Principal id cannot be null or blank");
        }
        if (id.length() > MAX_LENGTH) {
            throw new IllegalArgumentException(
                String.format("Principal id exceeds %d characters", MAX_LENGTH));
        }
        return new Principal(id);
    }

    @Override
    public String toString() {
        return id;
    }
}
