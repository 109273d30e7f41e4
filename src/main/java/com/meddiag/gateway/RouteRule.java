package com.meddiag.gateway;

import com.meddiag.auth.model.Role;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * What the gatekeeper enforces for one route.
 *
 * @param method       HTTP method, or null for any
 * @param pattern      Ant-style path pattern
 * @param operation    rate-limit policy name, also the key prefix
 * @param requiresAuth whether a verified identity is needed
 * @param allowedRoles roles admitted when auth is required; empty means any role
 */
public record RouteRule(
        String method,
        String pattern,
        String operation,
        boolean requiresAuth,
        Set<Role> allowedRoles
) {

    public RouteRule {
        allowedRoles = allowedRoles == null || allowedRoles.isEmpty() ? Set.of() : Set.copyOf(allowedRoles);
    }

    public static RouteRule open(String method, String pattern, String operation) {
        return new RouteRule(method, pattern, operation, false, Set.of());
    }

    public static RouteRule authenticated(String method, String pattern, String operation, Role... roles) {
        Set<Role> allowed = roles.length == 0 ? Set.of() : EnumSet.copyOf(Arrays.asList(roles));
        return new RouteRule(method, pattern, operation, true, allowed);
    }

    public boolean permits(Role role) {
        return allowedRoles.isEmpty() || allowedRoles.contains(role);
    }
}
