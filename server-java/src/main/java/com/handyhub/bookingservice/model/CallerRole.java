package com.handyhub.bookingservice.model;

/**
 * Roles issued by the identity provider. The Spring authority is {@code ROLE_} plus the
 * upper-case name.
 */
public enum CallerRole {
    CLIENT,
    PROVIDER,
    CONTRACTOR,
    ADMIN;

    public String authority() {
        return "ROLE_" + name();
    }

    public static CallerRole parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return CallerRole.valueOf(raw.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
