package com.meddiag.auth.model;

public enum TokenKind {

    ACCESS("access"),
    REFRESH("refresh");

    private final String claimValue;

    TokenKind(String claimValue) {
        this.claimValue = claimValue;
    }

    public String getClaimValue() {
        return claimValue;
    }

    public static TokenKind fromClaim(String value) {
        for (TokenKind kind : values()) {
            if (kind.claimValue.equals(value)) {
                return kind;
            }
        }
        return null;
    }
}
