package com.flagship.token_ledger.ledger;

import java.math.BigInteger;
import java.time.Clock;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The token ledger state machine.
 *
 * This class enforces the core invariants:
 * 1. No balance is ever negative
 * 2. Total supply equals the sum of all balances
 * 3. Total supply and balances never exceed {@link TokenAmounts#MAX_AMOUNT}
 * 4. Transfer log sequence numbers are strictly increasing and gap-free
 * 5. Exactly one owner exists at all times
 *
 * Mutations run one at a time. Each one validates against the current state,
 * builds the next state and publishes it with a single volatile write, so a
 * rejected operation leaves nothing behind and queries never wait.
 */
public class TokenLedger {

    private final Object mutationLock = new Object();
    private final TransferLog transferLog = new TransferLog();
    private final Clock clock;

    private volatile LedgerState state;

    /**
     * Creates the ledger and allocates the whole initial supply to the deployer,
     * who also becomes the first owner. A non-zero initial supply is recorded as
     * the genesis mint (sequence number 1).
     *
     * @param name Token name
     * @param symbol Token symbol
     * @param decimals Number of decimal places of one whole token (0-255)
     * @param initialSupply Supply created at deployment, may be zero
     * @param deployer Identity deploying the ledger
     * @param clock Source of transfer timestamps
     * @throws IllegalArgumentException if any setting is out of range
     */
    public TokenLedger(String name, String symbol, int decimals, BigInteger initialSupply,
                       Principal deployer, Clock clock) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Token name is required");
        }
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Token symbol is required");
        }
        if (decimals < 0 || decimals > 255) {
            throw new IllegalArgumentException("Decimals must be between 0 and 255, got " + decimals);
        }
        if (initialSupply == null || initialSupply.signum() < 0
                || initialSupply.compareTo(TokenAmounts.MAX_AMOUNT) > 0) {
            throw new IllegalArgumentException("Initial supply must be between 0 and " + TokenAmounts.MAX_AMOUNT);
        }
        this.clock = Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(deployer, "deployer");

        TokenInfo tokenInfo = new TokenInfo(name, symbol, decimals, initialSupply);
        if (initialSupply.signum() == 0) {
            this.state = new LedgerState(Map.of(), tokenInfo, deployer, 0);
        } else {
            TransferRecord genesis = transferLog.append(null, deployer, initialSupply, clock.instant());
            this.state = new LedgerState(Map.of(deployer, initialSupply), tokenInfo, deployer,
                genesis.getSequenceNumber());
        }
    }

    // ==================== Dispatch ====================

    /**
     * Executes a mutating command as one atomic step.
     *
     * @param command The command to run
     * @return Receipt describing the outcome
     * @throws LedgerException if the command is rejected; state is unchanged in that case
     */
    public LedgerReceipt execute(LedgerCommand command) {
        Objects.requireNonNull(command, "command");
        synchronized (mutationLock) {
            return switch (command.getOperation()) {
                case CREATE_WALLET -> applyCreateWallet(command.getCaller());
                case MINT -> applyMint(command.getCaller(), command.getTarget(), command.getAmount());
                case TRANSFER -> applyTransfer(command.getCaller(), command.getTarget(), command.getAmount());
                case BURN -> applyBurn(command.getCaller(), command.getAmount());
                case CHANGE_OWNER -> applyChangeOwner(command.getCaller(), command.getTarget());
            };
        }
    }

    /**
     * Ensures an account exists for the caller.
     *
     * @return true if this call created the account, false if it already existed
     */
    public boolean createWallet(Principal caller) {
        return execute(LedgerCommand.createWallet(caller)).isChanged();
    }

    public TransferRecord mint(Principal caller, Principal recipient, BigInteger amount) {
        return execute(LedgerCommand.mint(caller, recipient, amount)).requireRecord();
    }

    public TransferRecord transfer(Principal caller, Principal recipient, BigInteger amount) {
        return execute(LedgerCommand.transfer(caller, recipient, amount)).requireRecord();
    }

    public TransferRecord burn(Principal caller, BigInteger amount) {
        return execute(LedgerCommand.burn(caller, amount)).requireRecord();
    }

    /**
     * Replaces the owner. Naming the current owner again is a successful no-op.
     *
     * @return true if the owner actually changed
     */
    public boolean changeOwner(Principal caller, Principal newOwner) {
        return execute(LedgerCommand.changeOwner(caller, newOwner)).isChanged();
    }

    // ==================== Queries ====================

    /**
     * Latest committed state.
     */
    public LedgerState snapshot() {
        return state;
    }

    /**
     * Balance of a principal; zero if no account has been materialized.
     */
    public BigInteger getBalance(Principal principal) {
        return state.balanceOf(principal);
    }

    public boolean hasWallet(Principal principal) {
        return state.hasAccount(principal);
    }

    public TokenInfo getTokenInfo() {
        return state.getTokenInfo();
    }

    public Principal getOwner() {
        return state.getOwner();
    }

    /**
     * Full transfer history in application order. Each call returns a fresh list.
     */
    public List<TransferRecord> getTransferHistory() {
        return transferLog.prefix(state.getLogSize());
    }

    /**
     * Converts whole tokens into base units using this token's decimals.
     */
    public BigInteger toBaseUnits(BigInteger wholeTokens) {
        return TokenAmounts.toBaseUnits(wholeTokens, state.getTokenInfo().getDecimals());
    }

    // ==================== Handlers ====================

    private LedgerReceipt applyCreateWallet(Principal caller) {
        LedgerState current = state;
        if (current.hasAccount(caller)) {
            return new LedgerReceipt(LedgerOperation.CREATE_WALLET, caller, false, null);
        }
        Map<Principal, BigInteger> balances = copyBalances(current);
        balances.put(caller, BigInteger.ZERO);
        publish(new LedgerState(freeze(balances), current.getTokenInfo(), current.getOwner(), current.getLogSize()));
        return new LedgerReceipt(LedgerOperation.CREATE_WALLET, caller, true, null);
    }

    private LedgerReceipt applyMint(Principal caller, Principal recipient, BigInteger amount) {
        LedgerState current = state;
        requireOwner(current, caller, LedgerOperation.MINT);
        BigInteger value = TokenAmounts.requirePositive(amount);

        BigInteger newBalance = TokenAmounts.checkedAdd(current.balanceOf(recipient), value);
        BigInteger newSupply = TokenAmounts.checkedAdd(current.getTokenInfo().getTotalSupply(), value);

        Map<Principal, BigInteger> balances = copyBalances(current);
        balances.put(recipient, newBalance);

        TransferRecord record = transferLog.append(null, recipient, value, clock.instant());
        publish(new LedgerState(freeze(balances), current.getTokenInfo().withTotalSupply(newSupply),
            current.getOwner(), current.getLogSize() + 1));
        return new LedgerReceipt(LedgerOperation.MINT, caller, true, record);
    }

    private LedgerReceipt applyTransfer(Principal caller, Principal recipient, BigInteger amount) {
        LedgerState current = state;
        BigInteger value = TokenAmounts.requirePositive(amount);
        if (caller.equals(recipient)) {
            throw new LedgerException(LedgerErrorCode.SAME_ACCOUNT,
                "Cannot transfer to the sending account: " + caller);
        }

        BigInteger newSenderBalance = TokenAmounts.checkedDebit(current.balanceOf(caller), value);
        BigInteger newRecipientBalance = TokenAmounts.checkedAdd(current.balanceOf(recipient), value);

        Map<Principal, BigInteger> balances = copyBalances(current);
        balances.put(caller, newSenderBalance);
        balances.put(recipient, newRecipientBalance);

        TransferRecord record = transferLog.append(caller, recipient, value, clock.instant());
        publish(new LedgerState(freeze(balances), current.getTokenInfo(), current.getOwner(),
            current.getLogSize() + 1));
        return new LedgerReceipt(LedgerOperation.TRANSFER, caller, true, record);
    }

    private LedgerReceipt applyBurn(Principal caller, BigInteger amount) {
        LedgerState current = state;
        BigInteger value = TokenAmounts.requirePositive(amount);

        BigInteger newBalance = TokenAmounts.checkedDebit(current.balanceOf(caller), value);
        // balance <= supply, so this cannot go negative
        BigInteger newSupply = current.getTokenInfo().getTotalSupply().subtract(value);

        Map<Principal, BigInteger> balances = copyBalances(current);
        balances.put(caller, newBalance);

        TransferRecord record = transferLog.append(caller, null, value, clock.instant());
        publish(new LedgerState(freeze(balances), current.getTokenInfo().withTotalSupply(newSupply),
            current.getOwner(), current.getLogSize() + 1));
        return new LedgerReceipt(LedgerOperation.BURN, caller, true, record);
    }

    private LedgerReceipt applyChangeOwner(Principal caller, Principal newOwner) {
        LedgerState current = state;
        requireOwner(current, caller, LedgerOperation.CHANGE_OWNER);
        if (current.getOwner().equals(newOwner)) {
            return new LedgerReceipt(LedgerOperation.CHANGE_OWNER, caller, false, null);
        }
        publish(new LedgerState(current.getBalances(), current.getTokenInfo(), newOwner, current.getLogSize()));
        return new LedgerReceipt(LedgerOperation.CHANGE_OWNER, caller, true, null);
    }

    // ==================== Helpers ====================

    private void requireOwner(LedgerState current, Principal caller, LedgerOperation operation) {
        if (!current.getOwner().equals(caller)) {
            throw new LedgerException(LedgerErrorCode.UNAUTHORIZED,
                String.format("Only the owner may %s; caller %s is not the owner", operation.tagName(), caller));
        }
    }

    private void publish(LedgerState next) {
        this.state = next;
    }

    private static Map<Principal, BigInteger> copyBalances(LedgerState current) {
        return new HashMap<>(current.getBalances());
    }

    private static Map<Principal, BigInteger> freeze(Map<Principal, BigInteger> balances) {
        return Collections.unmodifiableMap(balances);
    }
}
