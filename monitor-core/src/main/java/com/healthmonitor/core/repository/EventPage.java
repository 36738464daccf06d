package com.healthmonitor.core.repository;

import com.healthmonitor.core.model.IntegrationEvent;

import java.util.List;

/**
 * One page of query results. {@code total} counts every event that matched
 * the filters, before the page was sliced.
 */
public record EventPage(
    List<IntegrationEvent> events,
    int total,
    int offset,
    int limit,
    boolean hasMore
) {
    public EventPage {
        events = List.copyOf(events);
    }

    public static EventPage slice(List<IntegrationEvent> matched, int offset, int limit) {
        int from = Math.min(offset, matched.size());
        int to = (int) Math.min((long) offset + limit, matched.size());
        return new EventPage(
            matched.subList(from, to),
            matched.size(),
            offset,
            limit,
            (long) offset + limit < matched.size()
        );
    }
}
