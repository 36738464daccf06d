package com.healthmonitor.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.UUID;

/**
 * One observed interaction with an external integration.
 *
 * Primary Key: id
 *
 * Invariants:
 * - id, integration, eventType, status and timestamp never change
 * - error is present iff status is FAILURE
 * - classification and resolution are only ever changed on FAILURE events
 * - classification is attached at most once
 */
public record IntegrationEvent(
    // Identity
    UUID id,
    IntegrationType integration,
    String eventType,

    // Outcome
    EventStatus status,
    Instant timestamp,

    // Data
    JsonNode payload,
    ErrorDetail error,

    // Triage
    ErrorClassification classification,
    Resolution resolution
) {
    /**
     * Create a new event stamped with the given time, in the OPEN triage state.
     */
    public static IntegrationEvent create(
            IntegrationType integration,
            String eventType,
            EventStatus status,
            JsonNode payload,
            ErrorDetail error,
            Instant timestamp) {
        return new IntegrationEvent(
            UUID.randomUUID(),
            integration,
            eventType,
            status,
            timestamp,
            payload,
            error,
            null,
            Resolution.open()
        );
    }

    @JsonIgnore
    public boolean isFailure() {
        return status == EventStatus.FAILURE;
    }

    @JsonIgnore
    public boolean isClassified() {
        return classification != null;
    }

    /**
     * Triage state, treating a missing record as OPEN.
     */
    public ResolutionStatus resolutionStatus() {
        return resolution != null ? resolution.status() : ResolutionStatus.OPEN;
    }

    public IntegrationEvent withClassification(ErrorClassification newClassification) {
        return new IntegrationEvent(
            id, integration, eventType, status, timestamp,
            payload, error, newClassification, resolution
        );
    }

    public IntegrationEvent withResolution(Resolution newResolution) {
        return new IntegrationEvent(
            id, integration, eventType, status, timestamp,
            payload, error, classification, newResolution
        );
    }
}
