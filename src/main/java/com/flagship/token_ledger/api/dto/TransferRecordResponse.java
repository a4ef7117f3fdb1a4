package com.flagship.token_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.token_ledger.ledger.Principal;
import com.flagship.token_ledger.ledger.TransferRecord;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Response DTO for a transfer log entry.
 * {@code from} is null for mints and {@code to} is null for burns.
 */
@Value
@Builder
public class TransferRecordResponse {

    @JsonProperty("sequence_number")
    long sequenceNumber;

    @JsonProperty("kind")
    String kind;

    @JsonProperty("from")
    String from;

    @JsonProperty("to")
    String to;

    @JsonProperty("amount")
    BigInteger amount;

    @JsonProperty("timestamp")
    Instant timestamp;

    public static TransferRecordResponse from(TransferRecord record) {
        return TransferRecordResponse.builder()
            .sequenceNumber(record.getSequenceNumber())
            .kind(record.isMint() ? "MINT" : record.isBurn() ? "BURN" : "TRANSFER")
            .from(idOf(record.getFrom()))
            .to(idOf(record.getTo()))
            .amount(record.getAmount())
            .timestamp(record.getTimestamp())
            .build();
    }

    private static String idOf(Principal principal) {
        return principal != null ? principal.getId() : null;
    }
}
