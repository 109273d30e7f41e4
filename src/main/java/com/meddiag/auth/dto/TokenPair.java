package com.meddiag.auth.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Returned by login and rotation. Never stored: a new pair is minted every time.
 */
public record TokenPair(
        @JsonProperty("access_token") String accessToken,
        @JsonProperty("refresh_token") String refreshToken,
        @JsonProperty("token_type") String tokenType,
        @JsonProperty("expires_in") long expiresIn
) {
}
