package com.healthmonitor.core.exception;

/**
 * Base exception for all monitor errors.
 */
public class MonitorException extends RuntimeException {
    
    private final String errorCode;
    
    public MonitorException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    public MonitorException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public String getErrorCode() {
        return errorCode;
    }
}
