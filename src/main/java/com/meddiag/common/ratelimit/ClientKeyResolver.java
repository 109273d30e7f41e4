package com.meddiag.common.ratelimit;

import jakarta.servlet.http.HttpServletRequest;

import java.util.List;
import java.util.Set;

/**
 * Builds the rate-limit key {@code "{prefix}:{address}"} of a request.
 *
 * <p>The prefix keeps operations apart (login and registration never share a counter). The address is
 * the first {@code X-Forwarded-For} hop, then {@code X-Real-IP}, then the peer address. Forwarded
 * headers are honoured only when {@code trustForwardedHeaders} is on and, if a trusted-proxy list is
 * configured, the peer is on it; anything else could let a client pick its own bucket.</p>
 */
public class ClientKeyResolver {

    static final String UNKNOWN = "unknown";

    private final boolean trustForwardedHeaders;
    private final Set<String> trustedProxies;

    public ClientKeyResolver(boolean trustForwardedHeaders, List<String> trustedProxies) {
        this.trustForwardedHeaders = trustForwardedHeaders;
        this.trustedProxies = trustedProxies == null ? Set.of() : Set.copyOf(trustedProxies);
    }

    public static ClientKeyResolver from(RateLimitProperties props) {
        return new ClientKeyResolver(props.isTrustForwardedHeaders(), props.getTrustedProxies());
    }

    public String getClientKey(HttpServletRequest req, String prefix) {
        return (prefix == null ? "" : prefix) + ":" + resolveIp(req);
    }

    String resolveIp(HttpServletRequest req) {
        if (req == null) {
            return UNKNOWN;
        }
        String peer = req.getRemoteAddr();
        if (trustsForwardedFrom(peer)) {
            String xff = req.getHeader("X-Forwarded-For");
            if (xff != null && !xff.isBlank()) {
                String first = xff.split(",")[0].trim();
                if (!first.isBlank()) {
                    return first;
                }
            }
            String xri = req.getHeader("X-Real-IP");
            if (xri != null && !xri.isBlank()) {
                return xri.trim();
            }
        }
        return peer == null || peer.isBlank() ? UNKNOWN : peer;
    }

    private boolean trustsForwardedFrom(String peer) {
        if (!trustForwardedHeaders) {
            return false;
        }
        return trustedProxies.isEmpty() || (peer != null && trustedProxies.contains(peer));
    }
}
