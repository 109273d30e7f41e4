package com.meddiag.auth.model;

import java.time.Instant;

/**
 * Decoded, verified content of a credential.
 */
public record CredentialClaims(
        String subject,
        Role role,
        TokenKind kind,
        Instant issuedAt,
        Instant expiresAt,
        String tokenId
) {

    public AuthenticatedUser toUser() {
        return new AuthenticatedUser(subject, role, AuthenticatedUser.SOURCE_LOCAL);
    }
}
