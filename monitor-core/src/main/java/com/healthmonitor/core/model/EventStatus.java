package com.healthmonitor.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Outcome of a single integration event. Fixed at creation.
 */
public enum EventStatus {
    SUCCESS,
    FAILURE,
    PENDING;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static EventStatus fromValue(String value) {
        for (EventStatus candidate : values()) {
            if (candidate.value().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown event status: " + value);
    }
}
