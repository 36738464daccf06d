package com.healthmonitor.core.repository;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.healthmonitor.core.model.IntegrationEvent;

import java.text.Collator;
import java.util.Comparator;
import java.util.Locale;

/**
 * Fields an event query can be sorted by. Text fields compare their wire values
 * with a root-locale collator, so "alpha" sorts before "Zeta".
 */
public enum EventSortField {
    TIMESTAMP("timestamp", Comparator.comparing(IntegrationEvent::timestamp)),
    INTEGRATION("integration", Comparator.comparing(e -> e.integration().id(), Text.COLLATOR)),
    EVENT_TYPE("eventType", Comparator.comparing(IntegrationEvent::eventType, Text.COLLATOR)),
    STATUS("status", Comparator.comparing(e -> e.status().value(), Text.COLLATOR));

    private final String value;
    private final Comparator<IntegrationEvent> ascending;

    EventSortField(String value, Comparator<IntegrationEvent> ascending) {
        this.value = value;
        this.ascending = ascending;
    }

    public Comparator<IntegrationEvent> comparator(SortOrder order) {
        return order == SortOrder.ASC ? ascending : ascending.reversed();
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static EventSortField fromValue(String value) {
        for (EventSortField field : values()) {
            if (field.value.equalsIgnoreCase(value)) {
                return field;
            }
        }
        throw new IllegalArgumentException("Unknown sort field: " + value);
    }

    private static final class Text {
        static final Collator COLLATOR = Collator.getInstance(Locale.ROOT);
    }
}
