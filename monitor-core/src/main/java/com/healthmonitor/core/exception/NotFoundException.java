package com.healthmonitor.core.exception;

/**
 * Thrown when an event, pipeline, instance or execution is not found.
 */
public class NotFoundException extends MonitorException {
    
    public static final String ERROR_CODE = "NOT_FOUND";
    
    public NotFoundException(String entityType, String entityId) {
        super(ERROR_CODE, String.format(
            "%s not found: %s",
            entityType, entityId
        ));
    }
}
