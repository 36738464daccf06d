package com.healthmonitor.core.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Error reported by the external system for a failed event.
 * {@code code} and {@code context} are optional.
 */
public record ErrorDetail(
    String message,
    String code,
    JsonNode context
) {
    public static ErrorDetail of(String message, String code) {
        return new ErrorDetail(message, code, null);
    }
}
