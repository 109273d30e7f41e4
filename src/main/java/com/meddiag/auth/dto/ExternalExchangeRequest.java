package com.meddiag.auth.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record ExternalExchangeRequest(
        @JsonProperty("id_token")
        @NotBlank(message = "id_token_required")
        String idToken
) {
}
