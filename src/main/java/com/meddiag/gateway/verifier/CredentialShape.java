package com.meddiag.gateway.verifier;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Base64;

/**
 * Reads unverified claims from a compact JWS, only to decide which verifier it belongs to.
 * Nothing read here is trusted.
 */
public final class CredentialShape {

    private final String issuer;
    private final String audience;

    private CredentialShape(String issuer, String audience) {
        this.issuer = issuer;
        this.audience = audience;
    }

    /**
     * @return null when the string is not three base64url segments with a JSON object in the middle
     */
    public static CredentialShape peek(String credential, ObjectMapper objectMapper) {
        if (credential == null) {
            return null;
        }
        String[] parts = credential.split("\\.", -1);
        if (parts.length != 3 || parts[1].isEmpty()) {
            return null;
        }
        try {
            byte[] payload = Base64.getUrlDecoder().decode(parts[1]);
            JsonNode node = objectMapper.readTree(payload);
            if (node == null || !node.isObject()) {
                return null;
            }
            return new CredentialShape(text(node.get("iss")), audience(node.get("aud")));
        } catch (Exception e) {
            return null;
        }
    }

    public String issuer() {
        return issuer;
    }

    public String audience() {
        return audience;
    }

    private static String text(JsonNode node) {
        return node == null || !node.isTextual() ? null : node.asText();
    }

    private static String audience(JsonNode node) {
        if (node != null && node.isArray() && !node.isEmpty()) {
            return text(node.get(0));
        }
        return text(node);
    }
}
