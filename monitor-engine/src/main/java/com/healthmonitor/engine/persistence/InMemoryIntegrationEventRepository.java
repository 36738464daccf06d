package com.healthmonitor.engine.persistence;

import com.healthmonitor.core.model.ErrorClassification;
import com.healthmonitor.core.model.IntegrationEvent;
import com.healthmonitor.core.model.IntegrationType;
import com.healthmonitor.core.model.Resolution;
import com.healthmonitor.core.repository.EventPage;
import com.healthmonitor.core.repository.EventQuery;
import com.healthmonitor.core.repository.IntegrationEventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Bounded in-memory event store.
 *
 * Events are kept newest first; once the capacity is reached every append
 * evicts the oldest event. Eviction is silent data loss, the store is not
 * a durable log. All methods are synchronized so each operation runs to
 * completion before the next one starts.
 */
public class InMemoryIntegrationEventRepository implements IntegrationEventRepository {

    private static final Logger log = LoggerFactory.getLogger(InMemoryIntegrationEventRepository.class);

    public static final int DEFAULT_CAPACITY = 1000;

    private final int capacity;
    private final Deque<UUID> order = new ArrayDeque<>();
    private final Map<UUID, IntegrationEvent> events = new HashMap<>();

    public InMemoryIntegrationEventRepository() {
        this(DEFAULT_CAPACITY);
    }

    public InMemoryIntegrationEventRepository(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
    }

    @Override
    public synchronized Optional<IntegrationEvent> append(IntegrationEvent event) {
        if (events.putIfAbsent(event.id(), event) != null) {
            throw new IllegalArgumentException("Duplicate event id: " + event.id());
        }
        order.addFirst(event.id());

        if (order.size() <= capacity) {
            return Optional.empty();
        }
        IntegrationEvent evicted = events.remove(order.removeLast());
        log.debug("Evicted event {} ({}) at capacity {}", evicted.id(), evicted.integration().id(), capacity);
        return Optional.of(evicted);
    }

    @Override
    public synchronized Optional<IntegrationEvent> findById(UUID eventId) {
        return Optional.ofNullable(events.get(eventId));
    }

    @Override
    public synchronized EventPage query(EventQuery query) {
        Predicate<IntegrationEvent> filter = toPredicate(query);
        List<IntegrationEvent> matched = new ArrayList<>();
        for (UUID id : order) {
            IntegrationEvent event = events.get(id);
            if (filter.test(event)) {
                matched.add(event);
            }
        }
        // List.sort is stable, so ties keep newest-first insertion order
        matched.sort(query.sortBy().comparator(query.sortOrder()));
        return EventPage.slice(matched, query.offset(), query.limit());
    }

    @Override
    public synchronized List<IntegrationEvent> findByIntegrationSince(IntegrationType integration, Instant since) {
        List<IntegrationEvent> result = new ArrayList<>();
        for (UUID id : order) {
            IntegrationEvent event = events.get(id);
            if (event.integration() == integration && !event.timestamp().isBefore(since)) {
                result.add(event);
            }
        }
        return result;
    }

    @Override
    public synchronized Optional<IntegrationEvent> attachClassification(UUID eventId, ErrorClassification classification) {
        IntegrationEvent event = events.get(eventId);
        if (event == null || !event.isFailure()) {
            return Optional.empty();
        }
        if (event.isClassified()) {
            return Optional.of(event);
        }
        IntegrationEvent updated = event.withClassification(classification);
        events.put(eventId, updated);
        return Optional.of(updated);
    }

    @Override
    public synchronized Optional<IntegrationEvent> updateResolution(UUID eventId, UnaryOperator<Resolution> transition) {
        IntegrationEvent event = events.get(eventId);
        if (event == null || !event.isFailure()) {
            return Optional.empty();
        }
        Resolution current = event.resolution() != null ? event.resolution() : Resolution.open();
        IntegrationEvent updated = event.withResolution(transition.apply(current));
        events.put(eventId, updated);
        return Optional.of(updated);
    }

    @Override
    public synchronized int size() {
        return order.size();
    }

    @Override
    public int capacity() {
        return capacity;
    }

    @Override
    public synchronized void clear() {
        order.clear();
        events.clear();
    }

    private static Predicate<IntegrationEvent> toPredicate(EventQuery query) {
        Predicate<IntegrationEvent> predicate = e -> true;
        if (query.integration() != null) {
            predicate = predicate.and(e -> e.integration() == query.integration());
        }
        if (query.status() != null) {
            predicate = predicate.and(e -> e.status() == query.status());
        }
        if (query.resolutionStatus() != null) {
            predicate = predicate.and(e -> e.resolutionStatus() == query.resolutionStatus());
        }
        if (query.since() != null) {
            predicate = predicate.and(e -> !e.timestamp().isBefore(query.since()));
        }
        if (query.search() != null && !query.search().isBlank()) {
            String needle = query.search().toLowerCase(Locale.ROOT);
            predicate = predicate.and(e -> matchesSearch(e, needle));
        }
        return predicate;
    }

    private static boolean matchesSearch(IntegrationEvent event, String needle) {
        if (contains(event.eventType(), needle) || contains(event.integration().id(), needle)) {
            return true;
        }
        return event.error() != null
            && (contains(event.error().message(), needle) || contains(event.error().code(), needle));
    }

    private static boolean contains(String haystack, String needle) {
        return haystack != null && haystack.toLowerCase(Locale.ROOT).contains(needle);
    }
}
