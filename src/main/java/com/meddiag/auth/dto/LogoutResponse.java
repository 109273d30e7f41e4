package com.meddiag.auth.dto;

public record LogoutResponse(
        boolean accessTokenRevoked,
        boolean refreshTokenRevoked
) {
}
