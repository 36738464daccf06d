package com.healthmonitor.engine.simulation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.healthmonitor.core.model.ErrorDetail;
import com.healthmonitor.core.model.EventStatus;
import com.healthmonitor.core.model.IntegrationType;
import com.healthmonitor.engine.service.EventService;
import com.healthmonitor.engine.service.EventService.RecordEventRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Seeds the event store with a realistic mix of integration traffic for demos.
 *
 * Success events are drawn at random from a fixed catalogue; failure events
 * cover one scenario per integration so every triage path has something to
 * work on.
 */
public class DemoEventSimulator {

    private static final Logger log = LoggerFactory.getLogger(DemoEventSimulator.class);

    public static final String DEMO_MODE = "demo";

    static final int MIN_SUCCESS_EVENTS = 15;
    static final int EXTRA_SUCCESS_EVENTS = 6;
    static final int MIN_DEMO_FAILURES = 3;
    static final int EXTRA_DEMO_FAILURES = 3;

    private final EventService eventService;
    private final ObjectMapper objectMapper;
    private final Random random;
    private final Clock clock;

    public DemoEventSimulator(EventService eventService, ObjectMapper objectMapper, Random random, Clock clock) {
        this.eventService = eventService;
        this.objectMapper = objectMapper;
        this.random = random;
        this.clock = clock;
    }

    /**
     * Record 15-20 success events, then 3-5 failures in demo mode or every
     * failure scenario in any other mode.
     *
     * @param mode "demo" or any other value for the full failure set
     * @param reset Clear the event store first
     * @return How many events of each kind were recorded
     */
    public SeedResult seed(String mode, boolean reset) {
        if (reset) {
            eventService.clear();
        }

        List<RecordEventRequest> successes = successScenarios();
        int successCount = MIN_SUCCESS_EVENTS + random.nextInt(EXTRA_SUCCESS_EVENTS);
        for (int i = 0; i < successCount; i++) {
            eventService.recordEvent(successes.get(random.nextInt(successes.size())));
        }

        List<RecordEventRequest> failures = new ArrayList<>(failureScenarios());
        int failureCount = DEMO_MODE.equals(mode)
            ? MIN_DEMO_FAILURES + random.nextInt(EXTRA_DEMO_FAILURES)
            : failures.size();
        Collections.shuffle(failures, random);
        for (RecordEventRequest failure : failures.subList(0, failureCount)) {
            eventService.recordEvent(failure);
        }

        log.info("Seeded {} successful and {} failed demo events (mode={}, reset={})",
            successCount, failureCount, mode, reset);
        return new SeedResult(successCount, failureCount);
    }

    List<RecordEventRequest> successScenarios() {
        return List.of(
            success(IntegrationType.PROCORE, "project.sync",
                Map.of("project_id", 12847, "name", "Downtown Office Tower - Phase 2")),
            success(IntegrationType.PROCORE, "cost_code.updated",
                Map.of("code", "03-100", "name", "Concrete - Formwork")),
            success(IntegrationType.GUSTO, "employee.sync",
                Map.of("employee_id", "emp_9921", "name", "Mike Torres")),
            success(IntegrationType.GUSTO, "timecard.submitted",
                Map.of("employee", "Mike Torres", "hours", 84, "job_id", "JOB-4821")),
            success(IntegrationType.GUSTO, "payroll.completed",
                Map.of("employees_paid", 47, "total_gross", 187432.5)),
            success(IntegrationType.QUICKBOOKS, "invoice.created",
                Map.of("invoice_id", "INV-2024-042", "amount", 48750.0)),
            success(IntegrationType.QUICKBOOKS, "job_cost.sync",
                Map.of("job_id", "JOB-4821", "total_labor", 87432.5)),
            success(IntegrationType.STRIPE_ISSUING, "issuing_authorization.created",
                Map.of("cardholder", "Mike Torres", "merchant", "Home Depot #4521", "amount", 342.87)),
            success(IntegrationType.STRIPE_ISSUING, "issuing_transaction.created",
                Map.of("cardholder", "Sarah Chen", "merchant", "Lowes #2234", "amount", 156.0)),
            success(IntegrationType.CERTIFIED_PAYROLL, "report.generated",
                Map.of("report_type", "WH-347", "workers_included", 24)),
            success(IntegrationType.CERTIFIED_PAYROLL, "export.completed",
                Map.of("report_type", "LCPtracker", "records_exported", 47))
        );
    }

    List<RecordEventRequest> failureScenarios() {
        Map<String, Object> archivedContext = new LinkedHashMap<>();
        archivedContext.put("job_id", "JOB-4821");
        archivedContext.put("procore_project_id", 12847);
        archivedContext.put("last_successful_sync", clock.instant().minus(Duration.ofDays(1)).toString());

        Map<String, Object> declinedContext = new LinkedHashMap<>();
        declinedContext.put("cardholder", "Mike Torres");
        declinedContext.put("merchant", "Home Depot #4521");
        declinedContext.put("amount", 847.32);
        declinedContext.put("job_id", "JOB-4821");
        declinedContext.put("current_limit", 500);

        Map<String, Object> wageContext = new LinkedHashMap<>();
        wageContext.put("classification", "Electrician - Journeyman");
        wageContext.put("job_id", "JOB-4821");
        wageContext.put("county", "Los Angeles");
        wageContext.put("affected_employees", List.of("Mike Torres", "Sarah Chen", "James Wilson"));
        wageContext.put("deadline", clock.instant().plus(Duration.ofDays(2)).toString());

        return List.of(
            failure(IntegrationType.PROCORE, "project.sync",
                Map.of("project_id", 12847),
                "Entity not found: Project #12847 has been archived in Procore", "404",
                archivedContext),
            failure(IntegrationType.GUSTO, "employee.sync",
                Map.of("employee_id", "null"),
                "Validation failed: employee_id is required but was null", "400",
                Map.of("missing_fields", List.of("employee_id"))),
            failure(IntegrationType.QUICKBOOKS, "job_cost.sync",
                Map.of("job_id", "JOB-4821"),
                "GL Account mapping failed: Account \"6200 - Materials\" not found in QuickBooks",
                "ENTITY_NOT_FOUND",
                Map.of("miter_account", "6200", "miter_account_name", "Materials",
                    "suggested_qb_accounts", List.of("6000 - Cost of Goods Sold", "6100 - Supplies"))),
            failure(IntegrationType.STRIPE_ISSUING, "issuing_authorization.request",
                Map.of("cardholder", "Mike Torres", "amount", 847.32),
                "Authorization declined: spending_limit_exceeded", "card_declined",
                declinedContext),
            failure(IntegrationType.CERTIFIED_PAYROLL, "report.generation_failed",
                Map.of("report_type", "WH-347"),
                "Prevailing wage rate not configured for classification: Electrician - Journeyman",
                "MISSING_WAGE_RATE",
                wageContext)
        );
    }

    private RecordEventRequest success(IntegrationType integration, String eventType, Map<String, Object> payload) {
        return new RecordEventRequest(integration, eventType, EventStatus.SUCCESS, toJson(payload), null);
    }

    private RecordEventRequest failure(
            IntegrationType integration,
            String eventType,
            Map<String, Object> payload,
            String message,
            String code,
            Map<String, Object> context) {
        return new RecordEventRequest(
            integration, eventType, EventStatus.FAILURE, toJson(payload),
            new ErrorDetail(message, code, toJson(context)));
    }

    private JsonNode toJson(Map<String, Object> value) {
        return objectMapper.valueToTree(value);
    }

    /**
     * Counts of seeded events.
     */
    public record SeedResult(
        int successCount,
        int errorCount
    ) {
        public String message() {
            return String.format("Seeded %d successful events and %d error events", successCount, errorCount);
        }
    }
}
