package com.healthmonitor.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Outcome of one sync execution. Only RUNNING executions lack a response.
 * Completed executions are immutable.
 */
public enum SyncExecutionStatus {
    RUNNING,
    SUCCESS,
    PARTIAL,
    FAILED;

    /**
     * Success and partial runs both count towards the success rate.
     */
    public boolean countsAsSuccessful() {
        return this == SUCCESS || this == PARTIAL;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SyncExecutionStatus fromValue(String value) {
        for (SyncExecutionStatus candidate : values()) {
            if (candidate.value().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown sync execution status: " + value);
    }
}
