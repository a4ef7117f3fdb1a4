package com.flagship.token_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigInteger;

/**
 * Response DTO for wallet creation.
 * {@code created} is false when the wallet already existed.
 */
@Value
public class WalletResponse {

    @JsonProperty("principal")
    String principal;

    @JsonProperty("created")
    boolean created;

    @JsonProperty("balance")
    BigInteger balance;
}
