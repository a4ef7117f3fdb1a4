package com.flagship.token_ledger.ledger;

import java.math.BigInteger;

/**
 * Checked arithmetic over the token's unsigned 128-bit amount domain.
 *
 * Every helper validates before returning; none of them wraps around.
 */
public final class TokenAmounts {

    /**
     * Largest representable amount, balance or total supply: 2^128 - 1.
     */
    public static final BigInteger MAX_AMOUNT = BigInteger.ONE.shiftLeft(128).subtract(BigInteger.ONE);

    private TokenAmounts() {
    }

    /**
     * Validates an operation amount: must be in [1, MAX_AMOUNT].
     *
     * @throws LedgerException with INVALID_AMOUNT otherwise
     */
    public static BigInteger requirePositive(BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new LedgerException(LedgerErrorCode.INVALID_AMOUNT, "Amount must be greater than 0");
        }
        if (amount.compareTo(MAX_AMOUNT) > 0) {
            throw new LedgerException(LedgerErrorCode.INVALID_AMOUNT,
                "Amount exceeds the maximum representable value " + MAX_AMOUNT);
        }
        return amount;
    }

    /**
     * Adds two in-domain values.
     *
     * @throws LedgerException with OVERFLOW if the sum exceeds MAX_AMOUNT
     */
    public static BigInteger checkedAdd(BigInteger current, BigInteger amount) {
        BigInteger sum = current.add(amount);
        if (sum.compareTo(MAX_AMOUNT) > 0) {
            throw new LedgerException(LedgerErrorCode.OVERFLOW,
                String.format("Adding %s to %s exceeds the maximum representable value", amount, current));
        }
        return sum;
    }

    /**
     * Subtracts {@code amount} from a balance.
     *
     * @throws LedgerException with INSUFFICIENT_BALANCE if the balance is smaller than amount
     */
    public static BigInteger checkedDebit(BigInteger balance, BigInteger amount) {
        if (balance.compareTo(amount) < 0) {
            throw new LedgerException(LedgerErrorCode.INSUFFICIENT_BALANCE,
                String.format("Insufficient balance: balance=%s, requested=%s", balance, amount));
        }
        return balance.subtract(amount);
    }

    /**
     * Converts whole tokens into base units: {@code whole * 10^decimals}.
     *
     * @throws LedgerException with INVALID_AMOUNT for a negative input,
     *                         OVERFLOW if the product leaves the domain
     */
    public static BigInteger toBaseUnits(BigInteger wholeTokens, int decimals) {
        if (wholeTokens == null || wholeTokens.signum() < 0) {
            throw new LedgerException(LedgerErrorCode.INVALID_AMOUNT, "Token amount cannot be negative");
        }
        if (decimals < 0) {
            throw new IllegalArgumentException("Decimals cannot be negative");
        }
        BigInteger units = wholeTokens.multiply(BigInteger.TEN.pow(decimals));
        if (units.compareTo(MAX_AMOUNT) > 0) {
            throw new LedgerException(LedgerErrorCode.OVERFLOW,
                String.format("%s tokens with %d decimals exceeds the maximum representable value",
                    wholeTokens, decimals));
        }
        return units;
    }
}
