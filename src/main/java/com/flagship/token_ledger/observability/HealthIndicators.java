package com.flagship.token_ledger.observability;

import com.flagship.token_ledger.ledger.LedgerState;
import com.flagship.token_ledger.ledger.TokenLedger;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Custom health indicators for the token ledger.
 *
 * These health checks determine if the service is ready to accept traffic.
 */
public class HealthIndicators {

    /**
     * Health indicator for the supply invariant.
     * Down if the total supply no longer matches the sum of all balances.
     */
    @Component("ledgerHealth")
    public static class LedgerInvariantHealthIndicator implements HealthIndicator {

        private final TokenLedger ledger;

        public LedgerInvariantHealthIndicator(TokenLedger ledger) {
            this.ledger = ledger;
        }

        @Override
        public Health health() {
            LedgerState state = ledger.snapshot();
            Health.Builder builder = state.isSupplyConsistent() ? Health.up() : Health.down();

            return builder
                    .withDetail("totalSupply", state.getTokenInfo().getTotalSupply().toString())
                    .withDetail("sumOfBalances", state.sumOfBalances().toString())
                    .withDetail("accounts", state.getAccountCount())
                    .withDetail("transferLogSize", state.getLogSize())
                    .build();
        }
    }
}
