package com.meddiag.gateway;

import com.meddiag.auth.model.AuthenticatedUser;
import com.meddiag.auth.model.Role;

import java.util.Set;

/**
 * Verdict of the gatekeeper for one request.
 */
public record GateDecision(
        Outcome outcome,
        AuthenticatedUser user,
        long retryAfterSeconds,
        boolean blocked,
        Set<Role> requiredRoles
) {

    public enum Outcome {
        ADMIT,
        RATE_LIMITED,
        UNAUTHENTICATED,
        FORBIDDEN
    }

    private static final GateDecision UNAUTHENTICATED = new GateDecision(Outcome.UNAUTHENTICATED, null, 0, false, Set.of());

    /**
     * @param user null for anonymous requests on open routes
     */
    public static GateDecision admit(AuthenticatedUser user) {
        return new GateDecision(Outcome.ADMIT, user, 0, false, Set.of());
    }

    public static GateDecision rateLimited(long retryAfterSeconds, boolean blocked) {
        return new GateDecision(Outcome.RATE_LIMITED, null, retryAfterSeconds, blocked, Set.of());
    }

    public static GateDecision unauthenticated() {
        return UNAUTHENTICATED;
    }

    public static GateDecision forbidden(AuthenticatedUser user, Set<Role> requiredRoles) {
        return new GateDecision(Outcome.FORBIDDEN, user, 0, false, requiredRoles);
    }
}
