package com.meddiag.auth.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.Map;

/**
 * Token authority settings, bound from {@code meddiag.auth.*}.
 *
 * <ul>
 *   <li>jwtSecret: access-token signing secret, at least 32 bytes</li>
 *   <li>refreshSecret: optional; when blank the refresh key is derived from jwtSecret</li>
 *   <li>clockSkewSeconds: leeway applied to the {@code exp} check, 0 disables it</li>
 *   <li>revocationStore: {@code memory} or {@code redis}</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "meddiag.auth")
public record AuthProperties(
        String issuer,
        String jwtSecret,
        String refreshSecret,
        long accessTokenTtlSeconds,
        long refreshTokenTtlSeconds,
        long clockSkewSeconds,
        String revocationStore,
        Map<String, DemoUser> users,
        External external
) {

    public AuthProperties {
        if (issuer == null || issuer.isBlank()) {
            issuer = "meddiag";
        }
        if (accessTokenTtlSeconds <= 0) {
            accessTokenTtlSeconds = 3600;
        }
        if (refreshTokenTtlSeconds <= 0) {
            refreshTokenTtlSeconds = 7 * 24 * 3600;
        }
        if (clockSkewSeconds < 0) {
            clockSkewSeconds = 0;
        }
        if (revocationStore == null || revocationStore.isBlank()) {
            revocationStore = "memory";
        }
        users = users == null ? Map.of() : Map.copyOf(users);
        if (external == null) {
            external = new External(null, null, null);
        }
    }

    /**
     * Shorthand used by tests and by callers that only care about the signing material.
     */
    public static AuthProperties of(String issuer, String jwtSecret, long accessTtl, long refreshTtl) {
        return new AuthProperties(issuer, jwtSecret, null, accessTtl, refreshTtl, 0, "memory", null, null);
    }

    /** A login account served by the in-memory user store. */
    public record DemoUser(String passwordHash, String role) {
    }

    /**
     * Tokens minted by an external identity provider (HS256 shared secret).
     * Verification through this path is off while {@code jwtSecret} is blank.
     */
    public record External(String jwtSecret, String issuer, String audience) {

        public External {
            if (audience == null || audience.isBlank()) {
                audience = "authenticated";
            }
        }

        public boolean isEnabled() {
            return jwtSecret != null && !jwtSecret.isBlank();
        }
    }
}
