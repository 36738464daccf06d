package com.healthmonitor.engine.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.healthmonitor.core.model.ErrorDetail;
import com.healthmonitor.core.model.EventStatus;
import com.healthmonitor.core.model.IntegrationEvent;
import com.healthmonitor.core.model.IntegrationType;
import com.healthmonitor.core.model.ResolutionStatus;
import com.healthmonitor.core.repository.EventPage;
import com.healthmonitor.core.repository.EventSortField;
import com.healthmonitor.core.repository.SortOrder;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Ingestion, lookup and triage of integration events.
 */
public interface EventService {

    /**
     * Record a new event at the head of the store.
     *
     * @param request The event to record
     * @return The stored event with its id and timestamp assigned
     */
    IntegrationEvent recordEvent(RecordEventRequest request);

    /**
     * Get an event by ID.
     *
     * @param eventId The event ID
     * @return The event
     * @throws com.healthmonitor.core.exception.NotFoundException if the event is not retained
     */
    IntegrationEvent getEvent(UUID eventId);

    /**
     * List events, without page metadata. Defaults to 50 results.
     */
    List<IntegrationEvent> listEvents(EventFilter filter);

    /**
     * List one page of events. Defaults to 25 results per page.
     */
    EventPage listEventsPaginated(EventFilter filter);

    /**
     * Trailing 24h statistics for one integration.
     */
    EventStats getEventStats(IntegrationType integration);

    /**
     * Acknowledge a failure event.
     *
     * @param eventId The event ID
     * @param actor Who acknowledged it; "anonymous" when null
     * @return The updated event
     * @throws com.healthmonitor.core.exception.InvalidEventStateException if the event is not a failure
     */
    IntegrationEvent acknowledge(UUID eventId, String actor);

    /**
     * Resolve a failure event, keeping any acknowledgement.
     *
     * @param eventId The event ID
     * @param actor Who resolved it; "anonymous" when null
     * @param notes Optional resolution notes
     * @return The updated event
     */
    IntegrationEvent resolve(UUID eventId, String actor, String notes);

    /**
     * Reopen a failure event from any state.
     */
    IntegrationEvent reopen(UUID eventId);

    /**
     * Remove every event.
     */
    void clear();

    /**
     * Request to record an event.
     */
    record RecordEventRequest(
        IntegrationType integration,
        String eventType,
        EventStatus status,
        JsonNode payload,
        ErrorDetail error
    ) {}

    /**
     * Filter criteria for listing events. Null fields fall back to defaults.
     */
    record EventFilter(
        IntegrationType integration,
        EventStatus status,
        ResolutionStatus resolutionStatus,
        Instant since,
        String search,
        EventSortField sortBy,
        SortOrder sortOrder,
        Integer offset,
        Integer limit
    ) {
        public static EventFilter none() {
            return new EventFilter(null, null, null, null, null, null, null, null, null);
        }

        public static EventFilter forIntegration(IntegrationType integration, int limit) {
            return new EventFilter(integration, null, null, null, null, null, null, null, limit);
        }
    }

    /**
     * Event statistics for one integration over the trailing 24 hours.
     * successRate is a whole percentage, 100 when there were no events.
     */
    record EventStats(
        int eventsLast24h,
        int errorsLast24h,
        int successRate,
        Instant lastSync
    ) {}
}
