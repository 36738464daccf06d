package com.healthmonitor.core.model;

import java.time.Instant;
import java.util.Map;

/**
 * Inbound response of a completed sync execution.
 * {@code bodyPreview} is a truncated view of the body, not the full payload.
 */
public record SyncResponse(
    int statusCode,
    String statusText,
    Map<String, String> headers,
    String bodyPreview,
    long bodySize,
    long durationMs,
    Instant timestamp
) {
    public SyncResponse {
        headers = Map.copyOf(headers);
    }
}
