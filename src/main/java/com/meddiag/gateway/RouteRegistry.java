package com.meddiag.gateway;

import com.meddiag.common.ratelimit.RateLimitProperties;
import org.springframework.util.AntPathMatcher;

import java.util.List;

/**
 * Ordered route table; the first matching rule wins. Requests no rule matches get the default
 * rate-limit policy and no identity requirement.
 */
public class RouteRegistry {

    private static final RouteRule FALLBACK = RouteRule.open(null, "/**", RateLimitProperties.DEFAULT_OPERATION);

    private final List<RouteRule> rules;
    private final AntPathMatcher matcher = new AntPathMatcher();

    public RouteRegistry(List<RouteRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public RouteRule match(String method, String path) {
        for (RouteRule rule : rules) {
            if (rule.method() != null && !rule.method().equalsIgnoreCase(method)) {
                continue;
            }
            if (matcher.match(rule.pattern(), path)) {
                return rule;
            }
        }
        return FALLBACK;
    }

    public List<RouteRule> rules() {
        return rules;
    }
}
