package com.healthmonitor.advisory;

import com.fasterxml.jackson.databind.JsonNode;
import com.healthmonitor.core.exception.ClassificationPreconditionException;
import com.healthmonitor.core.model.IntegrationEvent;
import com.healthmonitor.core.model.IntegrationType;

import java.util.Locale;
import java.util.UUID;

/**
 * The parts of a failure event a classifier is allowed to see.
 */
public record ClassificationRequest(
    UUID eventId,
    IntegrationType integration,
    String eventType,
    String errorMessage,
    String errorCode,
    JsonNode errorContext,
    JsonNode payload
) {
    /**
     * @throws ClassificationPreconditionException if the event is not a failure or has no error
     */
    public static ClassificationRequest from(IntegrationEvent event) {
        if (!event.isFailure() || event.error() == null) {
            throw new ClassificationPreconditionException(event.id());
        }
        return new ClassificationRequest(
            event.id(),
            event.integration(),
            event.eventType(),
            event.error().message(),
            event.error().code(),
            event.error().context(),
            event.payload()
        );
    }

    String normalizedMessage() {
        return errorMessage == null ? "" : errorMessage.toLowerCase(Locale.ROOT);
    }

    String normalizedCode() {
        return errorCode == null ? "" : errorCode.toLowerCase(Locale.ROOT);
    }
}
