package com.flagship.token_ledger.ledger;

import lombok.Value;

import java.math.BigInteger;
import java.util.Map;

/**
 * Immutable, fully committed view of the ledger.
 *
 * A new instance is published after every successful mutation, so a reader
 * holding one sees either the state before or after an operation, never a
 * mix of both. {@code logSize} is the number of transfer log entries this
 * state accounts for.
 */
@Value
public class LedgerState {
    Map<Principal, BigInteger> balances;
    TokenInfo tokenInfo;
    Principal owner;
    long logSize;

    public BigInteger balanceOf(Principal principal) {
        return balances.getOrDefault(principal, BigInteger.ZERO);
    }

    public boolean hasAccount(Principal principal) {
        return balances.containsKey(principal);
    }

    public int getAccountCount() {
        return balances.size();
    }

    public BigInteger sumOfBalances() {
        return balances.values().stream()
            .reduce(BigInteger.ZERO, BigInteger::add);
    }

    /**
     * Total supply must equal the sum of all balances.
     */
    public boolean isSupplyConsistent() {
        return sumOfBalances().equals(tokenInfo.getTotalSupply());
    }
}
