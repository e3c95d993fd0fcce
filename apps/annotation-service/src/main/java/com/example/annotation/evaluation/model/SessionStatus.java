package com.example.annotation.evaluation.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Session lifecycle. {@code COMPLETED} is terminal.
 */
public enum SessionStatus {
    IN_PROGRESS("in_progress"),
    COMPLETED("completed");

    private final String value;

    SessionStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * @return the status, or null for unknown input
     */
    @JsonCreator
    public static SessionStatus fromValue(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (SessionStatus status : values()) {
            if (status.value.equals(normalized)) {
                return status;
            }
        }
        return null;
    }
}
