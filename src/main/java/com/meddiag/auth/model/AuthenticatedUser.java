package com.meddiag.auth.model;

/**
 * Identity handed to downstream handlers once the gatekeeper admitted a request.
 *
 * @param source which verifier produced it ({@code local} or {@code external})
 */
public record AuthenticatedUser(String subject, Role role, String source) {

    public static final String SOURCE_LOCAL = "local";
    public static final String SOURCE_EXTERNAL = "external";
}
