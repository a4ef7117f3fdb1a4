package com.flagship.token_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigInteger;

/**
 * Request DTO for moving tokens to a recipient.
 * Used by both mint and transfer; the sender is the authenticated caller.
 */
@Value
public class TransferRequest {

    @NotBlank(message = "Recipient is required")
    @JsonProperty("recipient")
    String recipient;

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    BigInteger amount;
}
