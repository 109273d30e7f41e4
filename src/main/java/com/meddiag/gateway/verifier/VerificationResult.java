package com.meddiag.gateway.verifier;

import com.meddiag.auth.model.AuthenticatedUser;

/**
 * Outcome of one {@link CredentialVerifier}.
 *
 * <ul>
 *   <li>VERIFIED: the credential is this verifier's and it checks out</li>
 *   <li>NOT_APPLICABLE: not this verifier's shape, try the next one</li>
 *   <li>REJECTED: this verifier's shape, but it failed; stop, do not fall through</li>
 * </ul>
 */
public record VerificationResult(Status status, AuthenticatedUser user) {

    public enum Status {
        VERIFIED,
        NOT_APPLICABLE,
        REJECTED
    }

    private static final VerificationResult NOT_APPLICABLE = new VerificationResult(Status.NOT_APPLICABLE, null);
    private static final VerificationResult REJECTED = new VerificationResult(Status.REJECTED, null);

    public static VerificationResult verified(AuthenticatedUser user) {
        return new VerificationResult(Status.VERIFIED, user);
    }

    public static VerificationResult notApplicable() {
        return NOT_APPLICABLE;
    }

    public static VerificationResult rejected() {
        return REJECTED;
    }

    public boolean isVerified() {
        return status == Status.VERIFIED;
    }
}
