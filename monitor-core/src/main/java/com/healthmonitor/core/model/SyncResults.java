package com.healthmonitor.core.model;

import java.util.List;

/**
 * Processing results of a sync execution.
 *
 * Invariants:
 * - recordsFetched = created + updated + skipped + failed
 * - recordsFailed > 0 only for FAILED executions
 */
public record SyncResults(
    int recordsFetched,
    int recordsCreated,
    int recordsUpdated,
    int recordsSkipped,
    int recordsFailed,
    List<SyncError> errors,
    List<SyncWarning> warnings,
    List<SyncChange> changes
) {
    public SyncResults {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
        changes = List.copyOf(changes);
    }

    /**
     * Message of the first error, if any.
     */
    public String firstErrorMessage() {
        return errors.isEmpty() ? null : errors.get(0).message();
    }
}
