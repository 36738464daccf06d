package com.healthmonitor.engine.sync;

import com.healthmonitor.core.model.IntegrationType;
import com.healthmonitor.core.model.SyncDirection;
import com.healthmonitor.core.model.SyncPipeline;
import com.healthmonitor.core.model.SyncSchedule;

import java.util.List;

/**
 * Built-in pipeline definitions and demo client names.
 */
public final class PipelineCatalog {

    public static final List<String> CLIENT_NAMES = List.of(
        "Acme Construction",
        "BuildRight Inc",
        "Metro Builders",
        "Summit Contractors",
        "Pacific Construction Co",
        "Valley Infrastructure",
        "Coastal Development",
        "Mountain View Builders"
    );

    private PipelineCatalog() {
    }

    public static List<SyncPipeline> defaultPipelines() {
        return List.of(
            pull("Procore Projects", IntegrationType.PROCORE, "projects",
                "Sync project data including budgets, status, and team assignments", 15, 30),
            pull("Procore Cost Codes", IntegrationType.PROCORE, "cost_codes",
                "Sync cost code structure for job costing", 60, 120),
            pull("Gusto Employees", IntegrationType.GUSTO, "employees",
                "Sync employee records, roles, and compensation data", 30, 60),
            pull("Gusto Timecards", IntegrationType.GUSTO, "timecards",
                "Sync timecard entries for payroll processing", 15, 30),
            pull("QuickBooks Invoices", IntegrationType.QUICKBOOKS, "invoices",
                "Sync invoice and payment data from accounting system", 30, 60),
            pull("QuickBooks GL Entries", IntegrationType.QUICKBOOKS, "gl_entries",
                "Sync general ledger entries for financial reporting", 60, 120),
            pull("Stripe Transactions", IntegrationType.STRIPE_ISSUING, "transactions",
                "Sync card transactions and authorizations", 5, 15)
        );
    }

    /**
     * Client id for the i-th generated client, counting from zero.
     */
    public static String clientId(int index) {
        return "client_" + (index + 1);
    }

    /**
     * Client name for the i-th generated client; names repeat past the list end.
     */
    public static String clientName(int index) {
        return CLIENT_NAMES.get(index % CLIENT_NAMES.size());
    }

    private static SyncPipeline pull(
            String name, IntegrationType integration, String dataType,
            String description, int intervalMinutes, int staleThresholdMinutes) {
        return SyncPipeline.define(
            name, integration, dataType, SyncDirection.PULL, description,
            new SyncSchedule(intervalMinutes, staleThresholdMinutes));
    }
}
