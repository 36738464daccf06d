package com.healthmonitor.engine.coordinator;

import com.healthmonitor.core.exception.InvalidEventStateException;
import com.healthmonitor.core.exception.NotFoundException;
import com.healthmonitor.core.model.IntegrationEvent;
import com.healthmonitor.core.model.IntegrationType;
import com.healthmonitor.core.model.Resolution;
import com.healthmonitor.core.repository.EventPage;
import com.healthmonitor.core.repository.EventQuery;
import com.healthmonitor.core.repository.IntegrationEventRepository;
import com.healthmonitor.engine.logging.LoggingContext;
import com.healthmonitor.engine.metrics.MonitorMetrics;
import com.healthmonitor.engine.service.EventService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Event ingestion and the resolution state machine.
 *
 * The repository signals an unknown or non-failure event with an empty
 * result; this coordinator turns those into exceptions for callers.
 */
public class EventCoordinator implements EventService {

    private static final Logger log = LoggerFactory.getLogger(EventCoordinator.class);

    static final String ANONYMOUS = "anonymous";
    private static final Duration STATS_WINDOW = Duration.ofHours(24);

    private final IntegrationEventRepository eventRepository;
    private final MonitorMetrics metrics;
    private final Clock clock;
    private final int defaultLimit;
    private final int defaultPageLimit;

    public EventCoordinator(IntegrationEventRepository eventRepository, MonitorMetrics metrics, Clock clock) {
        this(eventRepository, metrics, clock, EventQuery.DEFAULT_LIMIT, EventQuery.DEFAULT_PAGE_LIMIT);
    }

    public EventCoordinator(
            IntegrationEventRepository eventRepository,
            MonitorMetrics metrics,
            Clock clock,
            int defaultLimit,
            int defaultPageLimit) {
        this.eventRepository = eventRepository;
        this.metrics = metrics;
        this.clock = clock;
        this.defaultLimit = defaultLimit;
        this.defaultPageLimit = defaultPageLimit;
    }

    @Override
    public IntegrationEvent recordEvent(RecordEventRequest request) {
        if (request.integration() == null || request.status() == null) {
            throw new IllegalArgumentException("integration and status are required");
        }
        if (request.eventType() == null || request.eventType().isBlank()) {
            throw new IllegalArgumentException("eventType is required");
        }

        IntegrationEvent event = IntegrationEvent.create(
            request.integration(),
            request.eventType(),
            request.status(),
            request.payload(),
            request.error(),
            clock.instant()
        );

        try (var ctx = LoggingContext.forEvent(event)) {
            if (event.isFailure() && event.error() == null) {
                log.warn("Failure event {} recorded without error detail; it cannot be classified", event.eventType());
            }
            eventRepository.append(event).ifPresent(evicted -> metrics.eventEvicted(evicted.integration()));
            metrics.eventRecorded(event.integration(), event.status());
            log.info("Recorded {} event {}", event.status().value(), event.eventType());
        }
        return event;
    }

    @Override
    public IntegrationEvent getEvent(UUID eventId) {
        return eventRepository.findById(eventId)
            .orElseThrow(() -> new NotFoundException("Event", eventId.toString()));
    }

    @Override
    public List<IntegrationEvent> listEvents(EventFilter filter) {
        return eventRepository.query(toQuery(filter, defaultLimit)).events();
    }

    @Override
    public EventPage listEventsPaginated(EventFilter filter) {
        return eventRepository.query(toQuery(filter, defaultPageLimit));
    }

    @Override
    public EventStats getEventStats(IntegrationType integration) {
        Instant since = clock.instant().minus(STATS_WINDOW);
        List<IntegrationEvent> recent = eventRepository.findByIntegrationSince(integration, since);

        int total = recent.size();
        int failures = (int) recent.stream().filter(IntegrationEvent::isFailure).count();
        int successRate = total > 0 ? (int) Math.round((total - failures) * 100.0 / total) : 100;
        Instant lastSync = recent.isEmpty() ? null : recent.get(0).timestamp();

        return new EventStats(total, failures, successRate, lastSync);
    }

    @Override
    public IntegrationEvent acknowledge(UUID eventId, String actor) {
        String by = actorOrAnonymous(actor);
        Instant now = clock.instant();
        return transition(eventId, "acknowledge", r -> r.acknowledge(by, now));
    }

    @Override
    public IntegrationEvent resolve(UUID eventId, String actor, String notes) {
        String by = actorOrAnonymous(actor);
        Instant now = clock.instant();
        return transition(eventId, "resolve", r -> r.resolve(by, notes, now));
    }

    @Override
    public IntegrationEvent reopen(UUID eventId) {
        return transition(eventId, "reopen", Resolution::reopen);
    }

    @Override
    public void clear() {
        int size = eventRepository.size();
        eventRepository.clear();
        log.info("Cleared {} events", size);
    }

    private IntegrationEvent transition(UUID eventId, String operation, UnaryOperator<Resolution> change) {
        try (var ctx = LoggingContext.forEvent(eventId)) {
            IntegrationEvent updated = eventRepository.updateResolution(eventId, change)
                .orElseThrow(() -> rejection(eventId, operation));
            metrics.resolutionTransition(operation);
            log.info("Event {} -> {}", operation, updated.resolutionStatus().value());
            return updated;
        }
    }

    private RuntimeException rejection(UUID eventId, String operation) {
        IntegrationEvent event = getEvent(eventId);
        return new InvalidEventStateException(eventId, event.status(), operation);
    }

    private EventQuery toQuery(EventFilter filter, int fallbackLimit) {
        return EventQuery.builder()
            .integration(filter.integration())
            .status(filter.status())
            .resolutionStatus(filter.resolutionStatus())
            .since(filter.since())
            .search(filter.search())
            .sort(filter.sortBy(), filter.sortOrder())
            .offset(filter.offset() != null ? filter.offset() : 0)
            .limit(filter.limit() != null ? filter.limit() : fallbackLimit)
            .build();
    }

    private static String actorOrAnonymous(String actor) {
        return actor == null || actor.isBlank() ? ANONYMOUS : actor;
    }
}
