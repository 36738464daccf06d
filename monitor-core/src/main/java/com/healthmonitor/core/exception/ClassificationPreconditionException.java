package com.healthmonitor.core.exception;

import java.util.UUID;

/**
 * Thrown when classification is requested for an event that carries no
 * error. This is a caller bug and is never recovered by the fallback.
 */
public class ClassificationPreconditionException extends MonitorException {
    
    public static final String ERROR_CODE = "CLASSIFICATION_PRECONDITION";
    
    public ClassificationPreconditionException(UUID eventId) {
        super(ERROR_CODE, String.format(
            "Event %s has no error to classify",
            eventId
        ));
    }
}
