package com.healthmonitor.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Derived health of one client's sync pipeline instance.
 * Recomputed whenever an execution is recorded for the instance.
 */
public enum SyncInstanceStatus {
    /**
     * Latest execution succeeded and the schedule is on time.
     */
    HEALTHY,

    /**
     * The next scheduled sync is overdue past the pipeline's stale threshold.
     */
    STALE,

    /**
     * The most recent execution failed.
     */
    FAILING,

    /**
     * Instance switched off; no status derivation applies.
     */
    DISABLED;

    public boolean requiresAttention() {
        return this == STALE || this == FAILING;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SyncInstanceStatus fromValue(String value) {
        for (SyncInstanceStatus candidate : values()) {
            if (candidate.value().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown sync instance status: " + value);
    }
}
