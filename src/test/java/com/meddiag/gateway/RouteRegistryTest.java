package com.meddiag.gateway;

import com.meddiag.auth.model.Role;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RouteRegistryTest {

    private final RouteRegistry routes = GatekeeperConfig.defaultRoutes();

    @Test
    void match_ShouldMapAuthEndpointsToTheirOperations() {
        assertThat(routes.match("POST", "/auth/login").operation()).isEqualTo("login");
        assertThat(routes.match("POST", "/auth/register").operation()).isEqualTo("register");
        assertThat(routes.match("POST", "/auth/forgot-password").operation()).isEqualTo("forgot_password");
        assertThat(routes.match("POST", "/auth/external/exchange").operation()).isEqualTo("google_auth");
        assertThat(routes.match("post", "/auth/login").requiresAuth()).isFalse();
    }

    @Test
    void match_ShouldRespectMethod() {
        assertThat(routes.match("GET", "/auth/me").requiresAuth()).isTrue();
        RouteRule postMe = routes.match("POST", "/auth/me");
        assertThat(postMe.requiresAuth()).isFalse();
        assertThat(postMe.operation()).isEqualTo("default");
    }

    @Test
    void match_ShouldApplyRoleRulesToPrefixes() {
        RouteRule admin = routes.match("DELETE", "/admin/users/42");
        assertThat(admin.requiresAuth()).isTrue();
        assertThat(admin.permits(Role.ADMIN)).isTrue();
        assertThat(admin.permits(Role.AUDITOR)).isFalse();

        RouteRule audit = routes.match("GET", "/audit/log");
        assertThat(audit.permits(Role.AUDITOR)).isTrue();
        assertThat(audit.permits(Role.GP)).isFalse();

        RouteRule api = routes.match("GET", "/api/cases/7");
        assertThat(api.requiresAuth()).isTrue();
        assertThat(api.permits(Role.GP)).isTrue();
    }

    @Test
    void match_ShouldFallBackToOpenDefaultRule() {
        RouteRule rule = routes.match("GET", "/health");

        assertThat(rule.requiresAuth()).isFalse();
        assertThat(rule.operation()).isEqualTo("default");
    }

    @Test
    void match_ShouldPreferFirstMatchingRule() {
        RouteRegistry registry = new RouteRegistry(java.util.List.of(
                RouteRule.authenticated(null, "/api/admin/**", "default", Role.ADMIN),
                RouteRule.authenticated(null, "/api/**", "default")
        ));

        assertThat(registry.match("GET", "/api/admin/x").allowedRoles()).containsExactly(Role.ADMIN);
        assertThat(registry.match("GET", "/api/x").allowedRoles()).isEmpty();
    }
}
