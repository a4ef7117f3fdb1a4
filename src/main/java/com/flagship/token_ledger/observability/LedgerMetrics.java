package com.flagship.token_ledger.observability;

import com.flagship.token_ledger.ledger.LedgerState;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Centralized metrics for ledger operations.
 *
 * Metrics exposed:
 * - ledger.operations: Counter tagged by operation and outcome (success or error code)
 * - ledger.operation.latency: Timer per operation
 * - ledger.total_supply, ledger.accounts, ledger.transfer_log.size: Gauges over the committed state
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records the outcome of a ledger operation.
     * Uses registry.counter() for efficient meter lookup/creation.
     */
    public void recordOperation(String operation, String outcome) {
        registry.counter("ledger.operations",
                "operation", sanitizeTag(operation),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    /**
     * Records ledger operation latency.
     */
    public void recordOperationLatency(String operation, long durationMs) {
        registry.timer("ledger.operation.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    /**
     * Registers gauges that read the latest committed ledger state.
     */
    public void registerStateGauges(Supplier<LedgerState> stateSupplier) {
        Gauge.builder("ledger.total_supply", stateSupplier,
                        s -> s.get().getTokenInfo().getTotalSupply().doubleValue())
                .description("Current total token supply in base units")
                .strongReference(true)
                .register(registry);

        Gauge.builder("ledger.accounts", stateSupplier, s -> s.get().getAccountCount())
                .description("Number of materialized accounts")
                .strongReference(true)
                .register(registry);

        Gauge.builder("ledger.transfer_log.size", stateSupplier, s -> s.get().getLogSize())
                .description("Number of entries in the transfer log")
                .strongReference(true)
                .register(registry);
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
