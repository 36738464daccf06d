package com.healthmonitor.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;

/**
 * Triage record of a failure event.
 *
 * Every event carries one; new events start with {@link #open()}.
 * Transitions never reject:
 * - acknowledge overwrites all prior fields
 * - resolve keeps acknowledgedAt/acknowledgedBy and sets the resolved fields
 * - reopen discards everything back to the bare OPEN record
 */
public record Resolution(
    ResolutionStatus status,
    Instant acknowledgedAt,
    String acknowledgedBy,
    Instant resolvedAt,
    String resolvedBy,
    String notes
) {
    private static final Resolution OPEN = new Resolution(
        ResolutionStatus.OPEN, null, null, null, null, null);

    public static Resolution open() {
        return OPEN;
    }

    public Resolution acknowledge(String actor, Instant at) {
        return new Resolution(ResolutionStatus.ACKNOWLEDGED, at, actor, null, null, null);
    }

    public Resolution resolve(String actor, String resolutionNotes, Instant at) {
        return new Resolution(
            ResolutionStatus.RESOLVED,
            acknowledgedAt,
            acknowledgedBy,
            at,
            actor,
            resolutionNotes
        );
    }

    public Resolution reopen() {
        return OPEN;
    }

    @JsonIgnore
    public boolean isOpen() {
        return status == ResolutionStatus.OPEN;
    }
}
