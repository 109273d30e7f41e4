package com.meddiag.support;

import com.meddiag.auth.config.AuthProperties;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import java.util.Map;

public final class TestAuth {

    public static final String SECRET = "test-secret-test-secret-test-secret-0123456789";

    /** Low cost factor, tests only. */
    public static final BCryptPasswordEncoder ENCODER = new BCryptPasswordEncoder(4);

    private TestAuth() {
    }

    public static AuthProperties props() {
        return AuthProperties.of("meddiag", SECRET, 900, 7 * 24 * 3600);
    }

    /**
     * Same signing material as {@link #props()}, plus the demo accounts and an optional external provider.
     */
    public static AuthProperties propsWithUsers(AuthProperties.External external) {
        Map<String, AuthProperties.DemoUser> users = Map.of(
                "admin", new AuthProperties.DemoUser(ENCODER.encode("admin123"), "admin"),
                "nurse", new AuthProperties.DemoUser(ENCODER.encode("nurse123"), "gp")
        );
        return new AuthProperties("meddiag", SECRET, null, 900, 7 * 24 * 3600, 0, "memory", users, external);
    }
}
