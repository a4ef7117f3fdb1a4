package com.flagship.token_ledger.api.exception;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Standard API error response.
 * {@code code} carries the ledger error code for rejected ledger operations.
 */
@Value
@Builder
public class ApiError {
    String error;
    String code;
    String message;
    Map<String, String> details;
    Instant timestamp;
}
