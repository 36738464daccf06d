package com.healthmonitor.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The fixed set of external systems that produce integration events.
 * Each entry carries its wire id, display metadata and the vendor API
 * base URL used when describing outbound sync requests.
 */
public enum IntegrationType {
    PROCORE("procore", "Procore",
        "Project management - jobs, cost codes, daily logs",
        "https://api.procore.com/rest/v1.0"),
    GUSTO("gusto", "Gusto",
        "Payroll - employee data, timecards, payroll runs",
        "https://api.gusto.com/v1"),
    QUICKBOOKS("quickbooks", "QuickBooks",
        "Accounting - job costs, invoices, GL entries",
        "https://quickbooks.api.intuit.com/v3"),
    STRIPE_ISSUING("stripe_issuing", "Stripe Issuing",
        "Payments - virtual cards, authorizations, transactions",
        "https://api.stripe.com/v1/issuing"),
    CERTIFIED_PAYROLL("certified_payroll", "Certified Payroll",
        "Compliance - LCPtracker, WH-347 reports, prevailing wage",
        "https://api.lcptracker.com/v2");

    private final String id;
    private final String displayName;
    private final String description;
    private final String apiBaseUrl;

    IntegrationType(String id, String displayName, String description, String apiBaseUrl) {
        this.id = id;
        this.displayName = displayName;
        this.description = description;
        this.apiBaseUrl = apiBaseUrl;
    }

    @JsonValue
    public String id() {
        return id;
    }

    public String displayName() {
        return displayName;
    }

    public String description() {
        return description;
    }

    public String apiBaseUrl() {
        return apiBaseUrl;
    }

    /**
     * Resolve an integration from its wire id.
     *
     * @throws IllegalArgumentException if the id is not one of the fixed set
     */
    @JsonCreator
    public static IntegrationType fromId(String id) {
        for (IntegrationType type : values()) {
            if (type.id.equalsIgnoreCase(id)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown integration: " + id);
    }
}
