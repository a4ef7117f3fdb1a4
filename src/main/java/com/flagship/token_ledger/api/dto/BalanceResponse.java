package com.flagship.token_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigInteger;

@Value
public class BalanceResponse {

    @JsonProperty("principal")
    String principal;

    @JsonProperty("balance")
    BigInteger balance;
}
