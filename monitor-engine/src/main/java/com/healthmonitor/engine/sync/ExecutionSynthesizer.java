package com.healthmonitor.engine.sync;

import com.healthmonitor.core.model.ChangeType;
import com.healthmonitor.core.model.SyncChange;
import com.healthmonitor.core.model.SyncError;
import com.healthmonitor.core.model.SyncExecution;
import com.healthmonitor.core.model.SyncExecutionStatus;
import com.healthmonitor.core.model.SyncPipeline;
import com.healthmonitor.core.model.SyncRequest;
import com.healthmonitor.core.model.SyncResponse;
import com.healthmonitor.core.model.SyncResults;
import com.healthmonitor.core.model.SyncTrigger;
import com.healthmonitor.core.model.SyncWarning;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.UUID;

/**
 * Fabricates a plausible sync execution for a given outcome: timing, record
 * counts, canned errors and warnings, sample changes, and a sanitized
 * request/response pair against the vendor's API.
 *
 * All randomness comes from the injected {@link Random}, so a seeded source
 * reproduces the same executions.
 */
public class ExecutionSynthesizer {

    static final String REDACTED_AUTHORIZATION = "Bearer ****redacted****";
    static final String INCOMPLETE_DATA = "INCOMPLETE_DATA";

    /**
     * Canned failures a synthetic execution can report.
     */
    public enum SyncFailure {
        AUTH_EXPIRED("OAuth token expired. Re-authentication required.", 401),
        RATE_LIMITED("API rate limit exceeded. Retry after 60 seconds.", 429),
        TIMEOUT("Request timeout after 30000ms.", 401),
        INVALID_RESPONSE("Unexpected response format from API.", 401),
        CONNECTION_ERROR("Failed to establish connection to remote server.", 401);

        private final String message;
        private final int statusCode;

        SyncFailure(String message, int statusCode) {
            this.message = message;
            this.statusCode = statusCode;
        }

        public String message() {
            return message;
        }

        public int statusCode() {
            return statusCode;
        }

        /**
         * Expired credentials need a human; everything else can be retried.
         */
        public boolean retryable() {
            return this != AUTH_EXPIRED;
        }
    }

    private final Random random;

    public ExecutionSynthesizer(Random random) {
        this.random = random;
    }

    /**
     * Synthesize one completed execution.
     *
     * @param target Instance the execution belongs to
     * @param startedAt Start time
     * @param status Outcome; RUNNING produces no response and no completion time
     * @param trigger What started the run
     */
    public SyncExecution synthesize(
            ExecutionTarget target,
            Instant startedAt,
            SyncExecutionStatus status,
            SyncTrigger trigger) {
        SyncPipeline pipeline = target.pipeline();
        boolean failed = status == SyncExecutionStatus.FAILED;

        long durationMs = 500 + random.nextInt(2500);
        Instant completedAt = startedAt.plusMillis(durationMs);

        int created = random.nextInt(3);
        int updated = random.nextInt(10);
        int recordsFailed = failed ? random.nextInt(5) + 1 : 0;
        // Fetched always covers every record that was acted on
        int fetched = Math.max(10 + random.nextInt(90), created + updated + recordsFailed);
        int skipped = fetched - created - updated - recordsFailed;

        List<SyncError> errors = new ArrayList<>();
        SyncFailure failure = null;
        if (failed) {
            SyncFailure[] failures = SyncFailure.values();
            failure = failures[random.nextInt(failures.length)];
            errors.add(new SyncError(
                UUID.randomUUID(),
                null,
                null,
                failure.message(),
                failure.name(),
                Map.of("pipeline", pipeline.name(), "attempt", 1),
                failure.retryable(),
                completedAt));
        }

        List<SyncWarning> warnings = new ArrayList<>();
        if (status == SyncExecutionStatus.PARTIAL || random.nextDouble() > 0.9) {
            warnings.add(new SyncWarning(
                UUID.randomUUID(), null, null,
                "Some records have missing optional fields", INCOMPLETE_DATA, completedAt));
        }

        String readableType = pipeline.dataType().replace('_', ' ');
        List<SyncChange> changes = new ArrayList<>();
        if (created > 0) {
            changes.add(new SyncChange(
                UUID.randomUUID(), "rec_" + random.nextInt(10000), "New " + readableType + " record",
                ChangeType.CREATED, List.of(), completedAt));
        }
        if (updated > 0) {
            changes.add(new SyncChange(
                UUID.randomUUID(), "rec_" + random.nextInt(10000), "Updated " + readableType + " record",
                ChangeType.UPDATED,
                List.of(new SyncChange.FieldChange("status", "pending", "active")),
                completedAt));
        }

        boolean running = status == SyncExecutionStatus.RUNNING;
        return new SyncExecution(
            UUID.randomUUID(),
            target.instanceId(),
            pipeline.id(),
            target.clientId(),
            target.clientName(),
            pipeline,
            startedAt,
            running ? null : completedAt,
            status,
            trigger,
            request(pipeline, startedAt),
            running ? null : response(failure, fetched, durationMs, completedAt),
            new SyncResults(fetched, created, updated, skipped, recordsFailed, errors, warnings, changes)
        );
    }

    private SyncRequest request(SyncPipeline pipeline, Instant startedAt) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Authorization", REDACTED_AUTHORIZATION);
        headers.put("Accept", "application/json");
        headers.put("X-Request-Id", UUID.randomUUID().toString());

        Map<String, String> params = new LinkedHashMap<>();
        params.put("per_page", "100");
        params.put("updated_since", startedAt.minus(Duration.ofHours(24)).toString());

        return new SyncRequest(pipeline.endpoint(), "GET", headers, params, startedAt);
    }

    private SyncResponse response(SyncFailure failure, int fetched, long durationMs, Instant completedAt) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("X-RateLimit-Remaining", String.valueOf(random.nextInt(1000)));
        headers.put("X-Total-Count", String.valueOf(fetched));
        headers.put("Content-Type", "application/json");

        String bodyPreview = failure != null
            ? "{\"error\":\"" + failure.message() + "\"}"
            : "[{\"id\":" + random.nextInt(10000) + ",\"name\":\"Sample Record\",\"updated_at\":\""
                + completedAt + "\"},...]";

        return new SyncResponse(
            failure != null ? failure.statusCode() : 200,
            failure != null ? "Error" : "OK",
            headers,
            bodyPreview,
            1024 + random.nextInt(50000),
            durationMs,
            completedAt
        );
    }

    /**
     * The instance an execution is synthesized for.
     */
    public record ExecutionTarget(
        String instanceId,
        String clientId,
        String clientName,
        SyncPipeline pipeline
    ) {}
}
