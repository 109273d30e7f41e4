package com.meddiag.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.meddiag.auth.model.Role;
import com.meddiag.common.ratelimit.ClientKeyResolver;
import com.meddiag.common.ratelimit.RateLimiter;
import com.meddiag.gateway.verifier.ExternalIdpCredentialVerifier;
import com.meddiag.gateway.verifier.LocalCredentialVerifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.List;

/**
 * Wires the gatekeeper in front of every MVC handler. The route table below is the one place that
 * says which operation, policy and roles apply to a path.
 */
@Configuration
public class GatekeeperConfig implements WebMvcConfigurer {

    private final RateLimiter rateLimiter;
    private final ClientKeyResolver clientKeyResolver;
    private final LocalCredentialVerifier localVerifier;
    private final ExternalIdpCredentialVerifier externalVerifier;
    private final ObjectMapper objectMapper;

    public GatekeeperConfig(RateLimiter rateLimiter,
                            ClientKeyResolver clientKeyResolver,
                            LocalCredentialVerifier localVerifier,
                            ExternalIdpCredentialVerifier externalVerifier,
                            ObjectMapper objectMapper) {
        this.rateLimiter = rateLimiter;
        this.clientKeyResolver = clientKeyResolver;
        this.localVerifier = localVerifier;
        this.externalVerifier = externalVerifier;
        this.objectMapper = objectMapper;
    }

    public static RouteRegistry defaultRoutes() {
        return new RouteRegistry(List.of(
                RouteRule.open("POST", "/auth/login", "login"),
                RouteRule.open("POST", "/auth/register", "register"),
                RouteRule.open("POST", "/auth/forgot-password", "forgot_password"),
                RouteRule.open("POST", "/auth/external/exchange", "google_auth"),
                RouteRule.open("POST", "/auth/refresh", "default"),
                RouteRule.authenticated("POST", "/auth/logout", "default"),
                RouteRule.authenticated("GET", "/auth/me", "default"),
                RouteRule.authenticated(null, "/admin/**", "default", Role.ADMIN),
                RouteRule.authenticated(null, "/audit/**", "default", Role.ADMIN, Role.AUDITOR),
                RouteRule.authenticated(null, "/api/**", "default")
        ));
    }

    @Bean
    public RouteRegistry routeRegistry() {
        return defaultRoutes();
    }

    @Bean
    public Gatekeeper gatekeeper() {
        return new Gatekeeper(rateLimiter, clientKeyResolver, List.of(localVerifier, externalVerifier));
    }

    @Bean
    public GatekeeperInterceptor gatekeeperInterceptor(Gatekeeper gatekeeper, RouteRegistry routeRegistry) {
        return new GatekeeperInterceptor(gatekeeper, routeRegistry, objectMapper);
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(gatekeeperInterceptor(gatekeeper(), routeRegistry()))
                .addPathPatterns("/**");
    }
}
