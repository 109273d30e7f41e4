package com.meddiag.gateway.verifier;

/**
 * One way of turning a bearer credential into an identity. The gatekeeper asks each verifier in
 * order and moves on only when a verifier answers {@link VerificationResult.Status#NOT_APPLICABLE}.
 */
public interface CredentialVerifier {

    String name();

    VerificationResult verify(String credential);
}
