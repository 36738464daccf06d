package com.healthmonitor.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Three-level health signal shared by integration and sync health.
 */
public enum IntegrationStatus {
    HEALTHY,
    DEGRADED,
    DOWN;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static IntegrationStatus fromValue(String value) {
        for (IntegrationStatus candidate : values()) {
            if (candidate.value().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown integration status: " + value);
    }
}
