package com.meddiag.auth.dto;

public record MeResponse(
        String username,
        String role,
        String source
) {
}
