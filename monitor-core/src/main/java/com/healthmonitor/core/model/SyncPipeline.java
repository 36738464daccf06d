package com.healthmonitor.core.model;

/**
 * Static definition of a recurring data flow for one integration.
 * Immutable; created once from the built-in catalog and never deleted.
 *
 * Primary Key: id ("pipeline_{integration}_{dataType}")
 */
public record SyncPipeline(
    String id,
    String name,
    IntegrationType integration,
    String dataType,
    SyncDirection direction,
    String description,
    SyncSchedule schedule
) {
    public static SyncPipeline define(
            String name,
            IntegrationType integration,
            String dataType,
            SyncDirection direction,
            String description,
            SyncSchedule schedule) {
        return new SyncPipeline(
            "pipeline_" + integration.id() + "_" + dataType,
            name,
            integration,
            dataType,
            direction,
            description,
            schedule
        );
    }

    /**
     * Vendor endpoint this pipeline reads from or writes to.
     */
    public String endpoint() {
        return integration.apiBaseUrl() + "/" + dataType;
    }
}
