package com.flagship.token_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigInteger;

@Value
public class BurnRequest {

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    BigInteger amount;
}
