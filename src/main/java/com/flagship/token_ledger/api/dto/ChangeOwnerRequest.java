package com.flagship.token_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

@Value
public class ChangeOwnerRequest {

    @NotBlank(message = "New owner is required")
    @JsonProperty("new_owner")
    String newOwner;
}
