package com.example.annotation.profile.model;

import com.example.annotation.common.exception.InvalidArgumentException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The two fixed roles. Stored and serialized in lower case.
 */
public enum Role {
    ADMIN("admin"),
    NAVIGATOR("navigator");

    private final String value;

    Role(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Parses a role name, case-insensitively.
     *
     * @throws InvalidArgumentException for null or unknown names
     */
    @JsonCreator
    public static Role fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidArgumentException("role", "Role is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Role role : values()) {
            if (role.value.equals(normalized)) {
                return role;
            }
        }
        throw new InvalidArgumentException("role", "Unknown role: " + value);
    }
}
