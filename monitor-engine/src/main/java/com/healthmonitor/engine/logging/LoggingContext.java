package com.healthmonitor.engine.logging;

import com.healthmonitor.core.model.IntegrationEvent;
import com.healthmonitor.core.model.SyncExecution;
import com.healthmonitor.core.model.SyncInstance;
import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC (Mapped Diagnostic Context) helper for structured logging.
 * Tags log lines with the event or sync instance being worked on.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forEvent(event)) {
 *     log.info("Classifying failure"); // includes eventId, integration
 * }
 * </pre>
 *
 * Log output with MDC:
 * 2024-06-01 10:30:45.123 [http-nio-8080-exec-1] INFO  c.h.e.c.ClassificationCoordinator - Classifying failure
 *   eventId=3f1c... integration=gusto traceId=9a2b41c0
 */
public final class LoggingContext implements AutoCloseable {

    public static final String EVENT_ID = "eventId";
    public static final String INTEGRATION = "integration";
    public static final String INSTANCE_ID = "instanceId";
    public static final String PIPELINE_ID = "pipelineId";
    public static final String CLIENT_ID = "clientId";
    public static final String EXECUTION_ID = "executionId";
    public static final String TRACE_ID = "traceId";

    private LoggingContext() {
    }

    public static LoggingContext forEvent(IntegrationEvent event) {
        LoggingContext ctx = new LoggingContext();
        put(EVENT_ID, event.id());
        put(INTEGRATION, event.integration().id());
        ensureTraceId();
        return ctx;
    }

    public static LoggingContext forEvent(UUID eventId) {
        LoggingContext ctx = new LoggingContext();
        put(EVENT_ID, eventId);
        ensureTraceId();
        return ctx;
    }

    public static LoggingContext forInstance(SyncInstance instance) {
        LoggingContext ctx = new LoggingContext();
        put(INSTANCE_ID, instance.id());
        put(PIPELINE_ID, instance.pipelineId());
        put(CLIENT_ID, instance.clientId());
        put(INTEGRATION, instance.pipeline().integration().id());
        ensureTraceId();
        return ctx;
    }

    /**
     * Add the execution id to the current context.
     */
    public static void setExecution(SyncExecution execution) {
        put(EXECUTION_ID, execution.id());
    }

    private static void put(String key, Object value) {
        if (value != null) {
            MDC.put(key, value.toString());
        }
    }

    private static void ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
    }

    @Override
    public void close() {
        MDC.remove(EVENT_ID);
        MDC.remove(INTEGRATION);
        MDC.remove(INSTANCE_ID);
        MDC.remove(PIPELINE_ID);
        MDC.remove(CLIENT_ID);
        MDC.remove(EXECUTION_ID);
        // Keep TRACE_ID for request-scoped tracing
    }
}
