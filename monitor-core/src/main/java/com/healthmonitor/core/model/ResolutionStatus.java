package com.healthmonitor.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Triage lifecycle states for a failure event.
 * There is no terminal state: every state can be reopened.
 */
public enum ResolutionStatus {
    /**
     * Initial state. Nobody has looked at the failure yet.
     * Transitions: -> ACKNOWLEDGED, RESOLVED, OPEN
     */
    OPEN,

    /**
     * An operator has seen the failure and taken ownership.
     * Transitions: -> ACKNOWLEDGED, RESOLVED, OPEN
     */
    ACKNOWLEDGED,

    /**
     * The underlying problem has been fixed.
     * Transitions: -> ACKNOWLEDGED, RESOLVED, OPEN
     */
    RESOLVED;

    public boolean needsAttention() {
        return this != RESOLVED;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ResolutionStatus fromValue(String value) {
        for (ResolutionStatus candidate : values()) {
            if (candidate.value().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown resolution status: " + value);
    }
}
