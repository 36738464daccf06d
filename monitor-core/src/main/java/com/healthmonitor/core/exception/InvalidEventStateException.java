package com.healthmonitor.core.exception;

import com.healthmonitor.core.model.EventStatus;
import java.util.UUID;

/**
 * Thrown when a triage or classification operation targets an event that
 * is not a failure.
 */
public class InvalidEventStateException extends MonitorException {
    
    public static final String ERROR_CODE = "INVALID_EVENT_STATE";
    
    public InvalidEventStateException(UUID eventId, EventStatus status, String operation) {
        super(ERROR_CODE, String.format(
            "Cannot %s event %s with status %s: only failed events can be triaged",
            operation, eventId, status.value()
        ));
    }
}
