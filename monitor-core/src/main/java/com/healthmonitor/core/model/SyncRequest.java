package com.healthmonitor.core.model;

import java.time.Instant;
import java.util.Map;

/**
 * Outbound request of a sync execution. Headers are sanitized before they
 * are stored; credentials never appear here.
 */
public record SyncRequest(
    String url,
    String method,
    Map<String, String> headers,
    Map<String, String> params,
    Instant timestamp
) {
    public SyncRequest {
        headers = Map.copyOf(headers);
        params = Map.copyOf(params);
    }
}
