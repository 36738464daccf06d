package com.healthmonitor.api.rest;

import com.healthmonitor.core.exception.ClassificationPreconditionException;
import com.healthmonitor.core.exception.InvalidEventStateException;
import com.healthmonitor.core.exception.MonitorException;
import com.healthmonitor.core.exception.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;

/**
 * Maps monitor exceptions onto HTTP responses.
 * Not found is 404, bad state or input is 400, anything else is 500.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    static final String BAD_REQUEST = "BAD_REQUEST";
    static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException ex) {
        return respond(HttpStatus.NOT_FOUND, ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler({InvalidEventStateException.class, ClassificationPreconditionException.class})
    public ResponseEntity<ErrorResponse> handleInvalidState(MonitorException ex) {
        return respond(HttpStatus.BAD_REQUEST, ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler({
        IllegalArgumentException.class,
        MethodArgumentTypeMismatchException.class,
        HttpMessageNotReadableException.class
    })
    public ResponseEntity<ErrorResponse> handleBadInput(Exception ex) {
        return respond(HttpStatus.BAD_REQUEST, BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(MonitorException.class)
    public ResponseEntity<ErrorResponse> handleMonitorException(MonitorException ex) {
        log.error("Unhandled monitor error {}", ex.getErrorCode(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ex.getErrorCode(), ex.getMessage());
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String code, String message) {
        return ResponseEntity
            .status(status)
            .body(new ErrorResponse(message, code, Instant.now()));
    }

    public record ErrorResponse(
        String error,
        String code,
        Instant timestamp
    ) {}
}
