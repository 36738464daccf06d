package com.healthmonitor.core.model;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Record-level change applied during a sync, with optional field diffs.
 */
public record SyncChange(
    UUID id,
    String recordId,
    String recordName,
    ChangeType changeType,
    List<FieldChange> fields,
    Instant timestamp
) {
    public SyncChange {
        fields = fields == null ? List.of() : List.copyOf(fields);
    }

    /**
     * One changed field. {@code oldValue} is null for newly set fields.
     */
    public record FieldChange(
        String field,
        String oldValue,
        String newValue
    ) {}
}
