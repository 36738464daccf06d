package com.healthmonitor.api.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.healthmonitor.core.model.ErrorClassification;
import com.healthmonitor.core.model.ErrorDetail;
import com.healthmonitor.core.model.EventStatus;
import com.healthmonitor.core.model.IntegrationEvent;
import com.healthmonitor.core.model.IntegrationType;
import com.healthmonitor.core.model.ResolutionStatus;
import com.healthmonitor.core.repository.EventPage;
import com.healthmonitor.core.repository.EventSortField;
import com.healthmonitor.core.repository.SortOrder;
import com.healthmonitor.engine.service.ClassificationService;
import com.healthmonitor.engine.service.ClassificationService.ClassificationResult;
import com.healthmonitor.engine.service.EventService;
import com.healthmonitor.engine.service.EventService.EventFilter;
import com.healthmonitor.engine.service.EventService.RecordEventRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;

/**
 * REST API for integration events: ingestion, listing, classification and triage.
 */
@RestController
@RequestMapping("/api/events")
public class EventController {

    private final EventService eventService;
    private final ClassificationService classificationService;

    public EventController(EventService eventService, ClassificationService classificationService) {
        this.eventService = eventService;
        this.classificationService = classificationService;
    }

    /**
     * Record an event.
     */
    @PostMapping
    public ResponseEntity<Map<String, Object>> createEvent(@RequestBody CreateEventRequest request) {
        if (request.integration() == null || request.status() == null) {
            throw new IllegalArgumentException("integration and status are required");
        }
        IntegrationEvent event = eventService.recordEvent(new RecordEventRequest(
            IntegrationType.fromId(request.integration()),
            request.eventType(),
            EventStatus.fromValue(request.status()),
            request.payload(),
            request.error() != null
                ? new ErrorDetail(request.error().message(), request.error().code(), request.error().context())
                : null
        ));
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("event", event));
    }

    /**
     * List events, up to 50 by default.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> listEvents(
            @RequestParam(required = false) String integration,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String resolutionStatus,
            @RequestParam(required = false) Instant since,
            @RequestParam(required = false) String search,
            @RequestParam(required = false) String sortBy,
            @RequestParam(required = false) String sortOrder,
            @RequestParam(required = false) Integer offset,
            @RequestParam(required = false) Integer limit) {

        List<IntegrationEvent> events = eventService.listEvents(toFilter(
            integration, status, resolutionStatus, since, search, sortBy, sortOrder, offset, limit));
        return ResponseEntity.ok(Map.of("events", events, "total", events.size()));
    }

    /**
     * One page of events, 25 per page by default, with the filtered total.
     */
    @GetMapping("/paginated")
    public ResponseEntity<EventPage> listEventsPaginated(
            @RequestParam(required = false) String integration,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String resolutionStatus,
            @RequestParam(required = false) Instant since,
            @RequestParam(required = false) String search,
            @RequestParam(required = false) String sortBy,
            @RequestParam(required = false) String sortOrder,
            @RequestParam(required = false) Integer offset,
            @RequestParam(required = false) Integer limit) {

        return ResponseEntity.ok(eventService.listEventsPaginated(toFilter(
            integration, status, resolutionStatus, since, search, sortBy, sortOrder, offset, limit)));
    }

    /**
     * Get an event by ID.
     */
    @GetMapping("/{eventId}")
    public ResponseEntity<Map<String, Object>> getEvent(@PathVariable UUID eventId) {
        return ResponseEntity.ok(Map.of("event", eventService.getEvent(eventId)));
    }

    /**
     * Classify a failure event. Repeated calls return the stored result.
     */
    @PostMapping("/{eventId}/classify")
    public ResponseEntity<ClassifyResponse> classify(@PathVariable UUID eventId) {
        ClassificationResult result = classificationService.classify(eventId);
        return ResponseEntity.ok(new ClassifyResponse(
            result.event(), result.classification(), result.cached(), result.source().tag()));
    }

    /**
     * Acknowledge a failure event.
     */
    @PostMapping("/{eventId}/acknowledge")
    public ResponseEntity<Map<String, Object>> acknowledge(
            @PathVariable UUID eventId,
            @RequestBody(required = false) TriageRequest request) {

        String actor = request != null ? request.by() : null;
        return ResponseEntity.ok(Map.of("event", eventService.acknowledge(eventId, actor)));
    }

    /**
     * Resolve a failure event.
     */
    @PostMapping("/{eventId}/resolve")
    public ResponseEntity<Map<String, Object>> resolve(
            @PathVariable UUID eventId,
            @RequestBody(required = false) TriageRequest request) {

        String actor = request != null ? request.by() : null;
        String notes = request != null ? request.notes() : null;
        return ResponseEntity.ok(Map.of("event", eventService.resolve(eventId, actor, notes)));
    }

    /**
     * Reopen a failure event.
     */
    @PostMapping("/{eventId}/reopen")
    public ResponseEntity<Map<String, Object>> reopen(@PathVariable UUID eventId) {
        return ResponseEntity.ok(Map.of("event", eventService.reopen(eventId)));
    }

    private static EventFilter toFilter(
            String integration,
            String status,
            String resolutionStatus,
            Instant since,
            String search,
            String sortBy,
            String sortOrder,
            Integer offset,
            Integer limit) {
        return new EventFilter(
            parse(integration, IntegrationType::fromId),
            parse(status, EventStatus::fromValue),
            parse(resolutionStatus, ResolutionStatus::fromValue),
            since,
            search,
            parse(sortBy, EventSortField::fromValue),
            parse(sortOrder, SortOrder::fromValue),
            offset,
            limit
        );
    }

    private static <T> T parse(String value, Function<String, T> parser) {
        return value == null || value.isBlank() ? null : parser.apply(value);
    }

    // ========== DTOs ==========

    public record CreateEventRequest(
        String integration,
        String eventType,
        String status,
        JsonNode payload,
        ErrorDto error
    ) {}

    public record ErrorDto(
        String message,
        String code,
        JsonNode context
    ) {}

    public record TriageRequest(
        String by,
        String notes
    ) {}

    public record ClassifyResponse(
        IntegrationEvent event,
        ErrorClassification classification,
        boolean cached,
        String source
    ) {}
}
