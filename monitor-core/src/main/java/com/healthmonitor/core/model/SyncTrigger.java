package com.healthmonitor.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * What caused a sync execution to start.
 */
public enum SyncTrigger {
    SCHEDULE,
    MANUAL,
    WEBHOOK;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SyncTrigger fromValue(String value) {
        for (SyncTrigger candidate : values()) {
            if (candidate.value().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown sync trigger: " + value);
    }
}
