package com.polyhunter.bounty.entity;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Admin roles, ordered from least to most privileged
 */
public enum AdminRole {
    REVIEWER("reviewer", 1),
    ADMIN("admin", 2),
    SUPER_ADMIN("super_admin", 3);

    private final String value;
    private final int level;

    AdminRole(String value, int level) {
        this.value = value;
        this.level = level;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public int getLevel() {
        return level;
    }

    /**
     * Parse a role header value; unknown values yield null
     */
    public static AdminRole fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (AdminRole role : values()) {
            if (role.value.equalsIgnoreCase(value) || role.name().equalsIgnoreCase(value)) {
                return role;
            }
        }
        return null;
    }
}
