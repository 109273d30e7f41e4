package com.meddiag.gateway.verifier;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.meddiag.auth.model.CredentialClaims;
import com.meddiag.auth.model.TokenKind;
import com.meddiag.auth.service.InvalidCredentialException;
import com.meddiag.auth.service.TokenAuthority;

/**
 * Access tokens minted by {@link TokenAuthority}. Claims this credential when its {@code iss} is ours.
 */
public class LocalCredentialVerifier implements CredentialVerifier {

    private final TokenAuthority tokenAuthority;
    private final ObjectMapper objectMapper;

    public LocalCredentialVerifier(TokenAuthority tokenAuthority, ObjectMapper objectMapper) {
        this.tokenAuthority = tokenAuthority;
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return "local";
    }

    @Override
    public VerificationResult verify(String credential) {
        CredentialShape shape = CredentialShape.peek(credential, objectMapper);
        if (shape == null || !tokenAuthority.issuer().equals(shape.issuer())) {
            return VerificationResult.notApplicable();
        }
        try {
            CredentialClaims claims = tokenAuthority.verify(credential, TokenKind.ACCESS);
            return VerificationResult.verified(claims.toUser());
        } catch (InvalidCredentialException e) {
            return VerificationResult.rejected();
        }
    }
}
