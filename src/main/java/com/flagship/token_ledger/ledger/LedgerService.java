package com.flagship.token_ledger.ledger;

import com.flagship.token_ledger.observability.CorrelationContext;
import com.flagship.token_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.List;

/**
 * Service entry point for all ledger operations.
 *
 * Every mutation goes through {@link #execute(LedgerCommand)}, which runs the
 * command against the {@link TokenLedger} and records logs and metrics for
 * the outcome. Rejections are logged at WARN and rethrown unchanged.
 */
@Service
@Slf4j
public class LedgerService {

    private final TokenLedger ledger;
    private final LedgerMetrics ledgerMetrics;

    public LedgerService(TokenLedger ledger, LedgerMetrics ledgerMetrics) {
        this.ledger = ledger;
        this.ledgerMetrics = ledgerMetrics;
        ledgerMetrics.registerStateGauges(ledger::snapshot);
    }

    /**
     * Executes a mutating command.
     *
     * @param command The command to run
     * @return Receipt of the applied command
     * @throws LedgerException if the ledger rejects the command
     */
    public LedgerReceipt execute(LedgerCommand command) {
        long startTime = System.currentTimeMillis();
        String operation = command.getOperation().tagName();
        MDC.put(CorrelationContext.PRINCIPAL_MDC_KEY, command.getCaller().getId());

        try {
            LedgerReceipt receipt = ledger.execute(command);

            long duration = System.currentTimeMillis() - startTime;
            ledgerMetrics.recordOperation(operation, receipt.isChanged() ? "success" : "noop");
            ledgerMetrics.recordOperationLatency(operation, duration);

            if (command.getOperation().isLogged()) {
                TransferRecord record = receipt.requireRecord();
                log.info("Ledger operation applied: operation={}, seq={}, from={}, to={}, amount={}, duration={}ms",
                    operation, record.getSequenceNumber(), record.getFrom(), record.getTo(), record.getAmount(), duration);
            } else {
                log.info("Ledger operation applied: operation={}, target={}, changed={}, duration={}ms",
                    operation, command.getTarget(), receipt.isChanged(), duration);
            }

            return receipt;

        } catch (LedgerException e) {
            long duration = System.currentTimeMillis() - startTime;
            ledgerMetrics.recordOperation(operation, e.getErrorCode().name().toLowerCase());
            ledgerMetrics.recordOperationLatency(operation, duration);
            log.warn("Ledger operation rejected: operation={}, code={}, reason={}",
                operation, e.getErrorCode(), e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.PRINCIPAL_MDC_KEY);
        }
    }

    /**
     * @return true if a new wallet was created, false if one already existed
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
     * Hands ownership to {@code newOwner}.
     *
     * @return The owner after the call
     */
    public Principal changeOwner(Principal caller, Principal newOwner) {
        LedgerReceipt receipt = execute(LedgerCommand.changeOwner(caller, newOwner));
        if (receipt.isChanged()) {
            log.info("Owner changed: previous={}, new={}", caller, newOwner);
        }
        return newOwner;
    }

    public BigInteger getBalance(Principal principal) {
        return ledger.getBalance(principal);
    }

    public TokenInfo getTokenInfo() {
        return ledger.getTokenInfo();
    }

    public List<TransferRecord> getTransferHistory() {
        return ledger.getTransferHistory();
    }

    public Principal getOwner() {
        return ledger.getOwner();
    }

    public BigInteger toBaseUnits(BigInteger wholeTokens) {
        return ledger.toBaseUnits(wholeTokens);
    }
}
