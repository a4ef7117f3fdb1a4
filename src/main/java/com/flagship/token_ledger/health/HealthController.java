package com.flagship.token_ledger.health;

import com.flagship.token_ledger.ledger.LedgerState;
import com.flagship.token_ledger.ledger.TokenLedger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Simple health check endpoint for liveness/readiness probes.
 * Unlike the Actuator health endpoint, this does not require authorization.
 */
@RestController
public class HealthController {

    private final TokenLedger ledger;

    public HealthController(TokenLedger ledger) {
        this.ledger = ledger;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());

        LedgerState state = ledger.snapshot();
        boolean consistent = state.isSupplyConsistent();
        response.put("ledger", consistent ? "UP" : "DOWN");
        response.put("transfer_log_size", state.getLogSize());

        if (!consistent) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        return ResponseEntity.ok(response);
    }
}
