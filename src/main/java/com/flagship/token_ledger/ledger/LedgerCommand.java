package com.flagship.token_ledger.ledger;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.math.BigInteger;
import java.util.Objects;

/**
 * A single mutating request against the ledger.
 *
 * {@code target} is the recipient for MINT and TRANSFER and the new owner for
 * CHANGE_OWNER; it is null otherwise. {@code amount} is null for operations
 * that carry none.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LedgerCommand {
    LedgerOperation operation;
    Principal caller;
    Principal target;
    BigInteger amount;

    public static LedgerCommand createWallet(Principal caller) {
        return new LedgerCommand(LedgerOperation.CREATE_WALLET, requireCaller(caller), null, null);
    }

    public static LedgerCommand mint(Principal caller, Principal recipient, BigInteger amount) {
        return new LedgerCommand(LedgerOperation.MINT, requireCaller(caller),
            Objects.requireNonNull(recipient, "recipient"), amount);
    }

    public static LedgerCommand transfer(Principal caller, Principal recipient, BigInteger amount) {
        return new LedgerCommand(LedgerOperation.TRANSFER, requireCaller(caller),
            Objects.requireNonNull(recipient, "recipient"), amount);
    }

    public static LedgerCommand burn(Principal caller, BigInteger amount) {
        return new LedgerCommand(LedgerOperation.BURN, requireCaller(caller), null, amount);
    }

    public static LedgerCommand changeOwner(Principal caller, Principal newOwner) {
        return new LedgerCommand(LedgerOperation.CHANGE_OWNER, requireCaller(caller),
            Objects.requireNonNull(newOwner, "newOwner"), null);
    }

    private static Principal requireCaller(Principal caller) {
        return Objects.requireNonNull(caller, "caller");
    }
}
