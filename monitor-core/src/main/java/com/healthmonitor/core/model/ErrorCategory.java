package com.healthmonitor.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Closed set of root-cause categories a failure can be classified into.
 */
public enum ErrorCategory {
    AUTH,
    RATE_LIMIT,
    DATA_VALIDATION,
    DATA_STATE_MISMATCH,
    NETWORK,
    SPENDING_CONTROL,
    COMPLIANCE,
    UNKNOWN;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ErrorCategory fromValue(String value) {
        for (ErrorCategory candidate : values()) {
            if (candidate.value().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown error category: " + value);
    }
}
