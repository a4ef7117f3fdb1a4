package com.flagship.token_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigInteger;

@Value
public class BaseUnitsResponse {

    @JsonProperty("whole")
    BigInteger whole;

    @JsonProperty("decimals")
    int decimals;

    @JsonProperty("base_units")
    BigInteger baseUnits;
}
