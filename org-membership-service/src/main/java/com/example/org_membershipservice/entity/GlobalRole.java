package com.example.org_membershipservice.entity;

import java.util.Optional;

/**
 * System-wide roles carried in the JWT.
 * DEV is the only role allowed to create the root council.
 */
public enum GlobalRole {
    DEV,
    ADMIN,
    USER;

    /**
     * Parse a role claim; unknown role strings are ignored.
     */
    public static Optional<GlobalRole> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String name = raw.startsWith("ROLE_") ? raw.substring(5) : raw;
        for (GlobalRole role : values()) {
            if (role.name().equalsIgnoreCase(name)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }

    public boolean isElevated() {
        return this == DEV || this == ADMIN;
    }
}
