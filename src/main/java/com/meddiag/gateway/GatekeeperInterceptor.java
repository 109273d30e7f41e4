package com.meddiag.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.meddiag.auth.model.Role;
import com.meddiag.auth.web.AuthContext;
import com.meddiag.common.api.ApiCodes;
import com.meddiag.common.api.Result;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.HandlerInterceptor;

import java.util.stream.Collectors;

/**
 * Runs the {@link Gatekeeper} in front of every handler and turns its verdict into HTTP:
 * <ul>
 *   <li>rate limited: 429, {@code Retry-After}, {@code X-RateLimit-Remaining: 0}</li>
 *   <li>unauthenticated: 401, {@code WWW-Authenticate: Bearer}, same body whatever failed</li>
 *   <li>forbidden: 403 naming the roles the route accepts</li>
 * </ul>
 * Admitted identities go to {@link AuthContext} and the {@link #REQ_ATTR_USER} request attribute.
 */
@Slf4j
public class GatekeeperInterceptor implements HandlerInterceptor {

    public static final String REQ_ATTR_USER = "X-Auth-User";
    public static final String HEADER_REMAINING = "X-RateLimit-Remaining";

    private final Gatekeeper gatekeeper;
    private final RouteRegistry routes;
    private final ObjectMapper objectMapper;

    public GatekeeperInterceptor(Gatekeeper gatekeeper, RouteRegistry routes, ObjectMapper objectMapper) {
        this.gatekeeper = gatekeeper;
        this.routes = routes;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        RouteRule rule = routes.match(request.getMethod(), path);
        GateDecision decision = gatekeeper.evaluate(request, rule);

        switch (decision.outcome()) {
            case ADMIT:
                if (decision.user() != null) {
                    request.setAttribute(REQ_ATTR_USER, decision.user());
                    AuthContext.setUser(decision.user());
                }
                return true;
            case RATE_LIMITED:
                long retryAfter = Math.max(1, decision.retryAfterSeconds());
                response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfter));
                response.setHeader(HEADER_REMAINING, "0");
                write(request, response, HttpStatus.TOO_MANY_REQUESTS,
                        decision.blocked() ? ApiCodes.TOO_MANY_REQUESTS_BLOCKED : ApiCodes.TOO_MANY_REQUESTS,
                        "Too many requests. Try again in " + retryAfter + " seconds.");
                return false;
            case FORBIDDEN:
                String required = decision.requiredRoles().stream()
                        .map(Role::getTag)
                        .sorted()
                        .collect(Collectors.joining(", "));
                write(request, response, HttpStatus.FORBIDDEN, ApiCodes.FORBIDDEN,
                        "Access denied. Required roles: " + required);
                return false;
            default:
                response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
                write(request, response, HttpStatus.UNAUTHORIZED, ApiCodes.UNAUTHORIZED, "unauthorized");
                return false;
        }
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response, Object handler, Exception ex) {
        AuthContext.clear();
    }

    private void write(HttpServletRequest request, HttpServletResponse response, HttpStatus status, int code, String message) {
        response.setStatus(status.value());
        response.setCharacterEncoding("UTF-8");
        response.setContentType(MediaType.APPLICATION_JSON_VALUE + ";charset=UTF-8");
        try {
            response.getWriter().write(objectMapper.writeValueAsString(Result.fail(code, message)));
        } catch (Exception writeErr) {
            log.debug("write gate response failed: path={}, status={}, err={}", request.getRequestURI(), status.value(), writeErr.toString());
        }
    }
}
