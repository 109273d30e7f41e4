package com.meddiag.gateway;

import com.meddiag.auth.model.AuthenticatedUser;
import com.meddiag.common.ratelimit.ClientKeyResolver;
import com.meddiag.common.ratelimit.RateLimitDecision;
import com.meddiag.common.ratelimit.RateLimitPolicy;
import com.meddiag.common.ratelimit.RateLimiter;
import com.meddiag.gateway.verifier.CredentialVerifier;
import com.meddiag.gateway.verifier.VerificationResult;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Admission first, identity second:
 * <ol>
 *   <li>rate-limit the caller under the route's operation</li>
 *   <li>if the route needs identity, run the bearer credential through the verifier chain</li>
 *   <li>check the verified role against the route</li>
 * </ol>
 *
 * <p>Stateless; every piece of state lives in the limiter backend or the revocation store.</p>
 */
@Slf4j
public class Gatekeeper {

    public static final String BEARER_PREFIX = "Bearer ";

    private final RateLimiter rateLimiter;
    private final ClientKeyResolver keyResolver;
    private final List<CredentialVerifier> verifiers;

    public Gatekeeper(RateLimiter rateLimiter, ClientKeyResolver keyResolver, List<CredentialVerifier> verifiers) {
        this.rateLimiter = rateLimiter;
        this.keyResolver = keyResolver;
        this.verifiers = List.copyOf(verifiers);
    }

    public GateDecision evaluate(HttpServletRequest request, RouteRule rule) {
        RateLimitPolicy policy = rateLimiter.policyFor(rule.operation());
        String key = keyResolver.getClientKey(request, rule.operation());
        RateLimitDecision admission = rateLimiter.checkRateLimit(key, policy);
        if (!admission.allowed()) {
            log.debug("rate limited: key={}, retryAfter={}, blocked={}", key, admission.retryAfterSeconds(), admission.blocked());
            return GateDecision.rateLimited(admission.retryAfterSeconds(), admission.blocked());
        }

        String credential = extractBearer(request);
        if (!rule.requiresAuth()) {
            // open route: attach the identity if one verifies, never reject
            AuthenticatedUser user = credential == null ? null : authenticate(credential);
            return GateDecision.admit(user);
        }
        if (credential == null) {
            return GateDecision.unauthenticated();
        }
        AuthenticatedUser user = authenticate(credential);
        if (user == null) {
            return GateDecision.unauthenticated();
        }
        if (!rule.permits(user.role())) {
            return GateDecision.forbidden(user, rule.allowedRoles());
        }
        return GateDecision.admit(user);
    }

    /**
     * @return null when no verifier accepts the credential or one of them rejects it
     */
    AuthenticatedUser authenticate(String credential) {
        for (CredentialVerifier verifier : verifiers) {
            VerificationResult result = verifier.verify(credential);
            switch (result.status()) {
                case VERIFIED:
                    return result.user();
                case REJECTED:
                    log.debug("credential rejected by verifier={}", verifier.name());
                    return null;
                default:
                    break;
            }
        }
        return null;
    }

    public static String extractBearer(HttpServletRequest request) {
        String header = request.getHeader("Authorization");
        if (header == null || !header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return null;
        }
        String token = header.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }
}
