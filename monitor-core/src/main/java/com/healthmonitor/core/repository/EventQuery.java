package com.healthmonitor.core.repository;

import com.healthmonitor.core.model.EventStatus;
import com.healthmonitor.core.model.IntegrationType;
import com.healthmonitor.core.model.ResolutionStatus;

import java.time.Instant;

/**
 * Filter, sort and page criteria for events.
 * Null filters match everything. Filtering, sorting and slicing are applied
 * in that order.
 *
 * Invariants:
 * - offset >= 0
 * - limit > 0
 */
public record EventQuery(
    // Filters
    IntegrationType integration,
    EventStatus status,
    ResolutionStatus resolutionStatus,
    Instant since,
    String search,

    // Sort
    EventSortField sortBy,
    SortOrder sortOrder,

    // Page
    int offset,
    int limit
) {
    public static final int DEFAULT_LIMIT = 50;
    public static final int DEFAULT_PAGE_LIMIT = 25;

    public EventQuery {
        if (sortBy == null) {
            sortBy = EventSortField.TIMESTAMP;
        }
        if (sortOrder == null) {
            sortOrder = SortOrder.DESC;
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative");
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
    }

    public static EventQuery all() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private IntegrationType integration;
        private EventStatus status;
        private ResolutionStatus resolutionStatus;
        private Instant since;
        private String search;
        private EventSortField sortBy;
        private SortOrder sortOrder;
        private int offset;
        private int limit = DEFAULT_LIMIT;

        public Builder integration(IntegrationType integration) {
            this.integration = integration;
            return this;
        }

        public Builder status(EventStatus status) {
            this.status = status;
            return this;
        }

        public Builder resolutionStatus(ResolutionStatus resolutionStatus) {
            this.resolutionStatus = resolutionStatus;
            return this;
        }

        public Builder since(Instant since) {
            this.since = since;
            return this;
        }

        public Builder search(String search) {
            this.search = search;
            return this;
        }

        public Builder sort(EventSortField sortBy, SortOrder sortOrder) {
            this.sortBy = sortBy;
            this.sortOrder = sortOrder;
            return this;
        }

        public Builder offset(int offset) {
            this.offset = offset;
            return this;
        }

        public Builder limit(int limit) {
            this.limit = limit;
            return this;
        }

        public EventQuery build() {
            return new EventQuery(
                integration, status, resolutionStatus, since, search,
                sortBy, sortOrder, offset, limit
            );
        }
    }
}
