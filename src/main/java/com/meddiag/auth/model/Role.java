package com.meddiag.auth.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of roles a credential may carry.
 *
 * <p>The tag is what goes on the wire (the {@code role} claim); the enum name is only used in code.</p>
 */
public enum Role {

    GP("gp"),
    SPECIALIST("specialist"),
    AUDITOR("auditor"),
    ADMIN("admin");

    private final String tag;

    Role(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    public static Optional<Role> fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            return Optional.empty();
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        for (Role role : values()) {
            if (role.tag.equals(normalized)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
