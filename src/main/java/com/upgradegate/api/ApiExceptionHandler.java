package com.upgradegate.api;

import com.upgradegate.audit.AuditStoreException;
import com.upgradegate.inventory.DeviceNotFoundException;
import com.upgradegate.upgrade.AttemptInProgressException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unified error response handler.
 *
 * All errors follow the machine-readable format:
 * {
 *   "error_code": "ATTEMPT_IN_PROGRESS",
 *   "message": "...",
 *   "timestamp": "2026-..."
 * }
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(DeviceNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleDeviceNotFound(DeviceNotFoundException ex) {
        return errorResponse("DEVICE_NOT_FOUND", ex.getMessage());
    }

    @ExceptionHandler(AttemptInProgressException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, Object> handleAttemptInProgress(AttemptInProgressException ex) {
        log.warn("Rejected request: {}", ex.getMessage());
        return errorResponse("ATTEMPT_IN_PROGRESS", ex.getMessage());
    }

    @ExceptionHandler(AuditStoreException.class)
    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    public Map<String, Object> handleAuditUnavailable(AuditStoreException ex) {
        log.error("Audit store unavailable: {}", ex.getMessage());
        return errorResponse("AUDIT_UNAVAILABLE", ex.getMessage());
    }

    @ExceptionHandler({
        MethodArgumentTypeMismatchException.class,
        HttpMessageNotReadableException.class
    })
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleParseErrors(Exception ex) {
        return errorResponse("BAD_REQUEST", "request format is invalid: " + ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleIllegalArgument(IllegalArgumentException ex) {
        return errorResponse("INVALID_ARGUMENT", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        return errorResponse("INTERNAL_ERROR", "an unexpected error occurred");
    }

    private Map<String, Object> errorResponse(String errorCode, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error_code", errorCode);
        body.put("message", message);
        body.put("timestamp", Instant.now().toString());
        return body;
    }
}
