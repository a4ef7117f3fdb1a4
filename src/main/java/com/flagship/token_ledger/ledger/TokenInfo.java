package com.flagship.token_ledger.ledger;

import lombok.Value;
import lombok.With;

import java.math.BigInteger;

/**
 * Token metadata snapshot.
 * name, symbol and decimals are fixed at initialization; only totalSupply moves.
 */
@Value
public class TokenInfo {
    String name;
    String symbol;
    int decimals;
    @With
    BigInteger totalSupply;
}
