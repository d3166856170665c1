package org.example.studio.controller;

import jakarta.servlet.http.HttpServletRequest;
import org.example.studio.config.RequestCorrelation;
import org.example.studio.workflow.InvalidTransitionException;
import org.example.studio.workflow.NotFoundException;
import org.example.studio.workflow.ValidationException;
import org.example.studio.workflow.WorkflowException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps workflow exceptions to JSON error bodies of the form
 * {@code {"error": ..., "code": ..., "status": ..., "requestId": ...}}.
 */
@RestControllerAdvice
public class WorkflowExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(WorkflowExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(ValidationException ex, HttpServletRequest request) {
        return body(HttpStatus.BAD_REQUEST, "validation_failed", ex.getMessage(), null, request);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(NotFoundException ex, HttpServletRequest request) {
        return body(HttpStatus.NOT_FOUND, "not_found", ex.getMessage(), null, request);
    }

    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidTransition(
            InvalidTransitionException ex, HttpServletRequest request) {
        String status = ex.getCurrentStatus() == null ? null : ex.getCurrentStatus().value();
        return body(HttpStatus.CONFLICT, "invalid_transition", ex.getMessage(), status, request);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, IllegalArgumentException.class})
    public ResponseEntity<Map<String, Object>> handleUnreadable(Exception ex, HttpServletRequest request) {
        return body(HttpStatus.BAD_REQUEST, "bad_request", "Malformed request", null, request);
    }

    @ExceptionHandler(WorkflowException.class)
    public ResponseEntity<Map<String, Object>> handleWorkflow(WorkflowException ex, HttpServletRequest request) {
        log.error("Workflow operation failed", ex);
        return body(HttpStatus.SERVICE_UNAVAILABLE, "workflow_error", ex.getMessage(), null, request);
    }

    private ResponseEntity<Map<String, Object>> body(
            HttpStatus httpStatus, String code, String message, String projectStatus, HttpServletRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        body.put("code", code);
        if (projectStatus != null) {
            body.put("status", projectStatus);
        }
        body.put("requestId", RequestCorrelation.resolveRequestId(request));
        return ResponseEntity.status(httpStatus).body(body);
    }
}
