package com.meddiag.auth.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param refreshToken optional; revoked together with the access token that authenticated the call
 */
public record LogoutRequest(
        @JsonProperty("refresh_token") String refreshToken
) {
}
