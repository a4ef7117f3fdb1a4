package com.flagship.token_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.token_ledger.ledger.TokenInfo;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

@Value
@Builder
public class TokenInfoResponse {

    @JsonProperty("name")
    String name;

    @JsonProperty("symbol")
    String symbol;

    @JsonProperty("decimals")
    int decimals;

    @JsonProperty("total_supply")
    BigInteger totalSupply;

    public static TokenInfoResponse from(TokenInfo tokenInfo) {
        return TokenInfoResponse.builder()
            .name(tokenInfo.getName())
            .symbol(tokenInfo.getSymbol())
            .decimals(tokenInfo.getDecimals())
            .totalSupply(tokenInfo.getTotalSupply())
            .build();
    }
}
