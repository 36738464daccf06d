package com.healthmonitor.engine.service;

import com.healthmonitor.core.model.ErrorClassification;
import com.healthmonitor.core.model.IntegrationEvent;

import java.util.UUID;

/**
 * Memoized failure classification.
 */
public interface ClassificationService {

    /**
     * Classify a failure event. The external capability is consulted at most
     * once per event; later calls return the stored classification. If the
     * capability fails, a deterministic rule-based result is used instead, so
     * this call never fails for an event that carries an error.
     *
     * @param eventId The event ID
     * @return The event, its classification and where the classification came from
     * @throws com.healthmonitor.core.exception.NotFoundException if the event is not retained
     * @throws com.healthmonitor.core.exception.InvalidEventStateException if the event is not a failure
     * @throws com.healthmonitor.core.exception.ClassificationPreconditionException if the failure has no error
     */
    ClassificationResult classify(UUID eventId);

    /**
     * Outcome of a classify call.
     */
    record ClassificationResult(
        IntegrationEvent event,
        ErrorClassification classification,
        boolean cached,
        Source source
    ) {}

    enum Source {
        /** Already attached to the event. */
        CACHE,
        /** Produced by the external capability. */
        EXTERNAL,
        /** Produced by the rule-based fallback. */
        FALLBACK;

        public String tag() {
            return name().toLowerCase(java.util.Locale.ROOT);
        }
    }
}
