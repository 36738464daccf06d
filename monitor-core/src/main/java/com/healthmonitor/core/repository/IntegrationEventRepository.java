package com.healthmonitor.core.repository;

import com.healthmonitor.core.model.ErrorClassification;
import com.healthmonitor.core.model.IntegrationEvent;
import com.healthmonitor.core.model.IntegrationType;
import com.healthmonitor.core.model.Resolution;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Repository for integration events.
 * Bounded: holds at most {@link #capacity()} events, newest first, and
 * evicts the oldest when a new event would exceed the cap.
 */
public interface IntegrationEventRepository {

    /**
     * Insert an event at the head of the store.
     *
     * @param event The event to insert
     * @return The evicted oldest event, if the cap was exceeded
     */
    Optional<IntegrationEvent> append(IntegrationEvent event);

    /**
     * Find an event by ID.
     *
     * @param eventId The event ID
     * @return The event if still retained
     */
    Optional<IntegrationEvent> findById(UUID eventId);

    /**
     * Filter, sort and page the retained events. Has no side effects.
     *
     * @param query The query criteria
     * @return The requested page with the pre-pagination total
     */
    EventPage query(EventQuery query);

    /**
     * Events for one integration at or after a point in time, newest first.
     *
     * @param integration The integration
     * @param since Lower bound (inclusive)
     * @return Matching events
     */
    List<IntegrationEvent> findByIntegrationSince(IntegrationType integration, Instant since);

    /**
     * Attach a classification to a failure event unless one is already present.
     *
     * @param eventId The event ID
     * @param classification The classification to attach
     * @return The stored event (carrying whichever classification won), or
     *         empty if the event is unknown or not a failure
     */
    Optional<IntegrationEvent> attachClassification(UUID eventId, ErrorClassification classification);

    /**
     * Apply a resolution transition to a failure event.
     *
     * @param eventId The event ID
     * @param transition Maps the current resolution to the next one
     * @return The updated event, or empty (and no mutation) if the event is
     *         unknown or not a failure
     */
    Optional<IntegrationEvent> updateResolution(UUID eventId, UnaryOperator<Resolution> transition);

    /**
     * Number of retained events.
     */
    int size();

    /**
     * Maximum number of retained events.
     */
    int capacity();

    /**
     * Remove every event.
     */
    void clear();
}
