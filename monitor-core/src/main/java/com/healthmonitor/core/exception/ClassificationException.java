package com.healthmonitor.core.exception;

/**
 * Thrown by a classification capability that timed out, is unavailable or
 * returned something unusable. Callers recover with the rule-based fallback.
 */
public class ClassificationException extends MonitorException {
    
    public static final String ERROR_CODE = "CLASSIFICATION_FAILED";
    
    public ClassificationException(String message) {
        super(ERROR_CODE, message);
    }
    
    public ClassificationException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
