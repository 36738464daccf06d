package com.healthmonitor.core.model;

import java.util.List;

/**
 * Advisory explanation of a failure event's root cause and fix.
 * Attached to an event at most once; the first successful classification wins.
 */
public record ErrorClassification(
    ErrorCategory category,
    Severity severity,
    String cause,
    String suggestedFix,
    List<String> affectedData,
    String businessImpact
) {
    public ErrorClassification {
        affectedData = affectedData == null ? List.of() : List.copyOf(affectedData);
    }
}
