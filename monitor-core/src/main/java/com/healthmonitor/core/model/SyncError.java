package com.healthmonitor.core.model;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Error raised while running a sync. Record fields are optional.
 */
public record SyncError(
    UUID id,
    String recordId,
    String recordName,
    String message,
    String code,
    Map<String, Object> context,
    boolean retryable,
    Instant timestamp
) {
    public SyncError {
        context = context == null ? Map.of() : Map.copyOf(context);
    }
}
