package com.cronpilot.scheduler.api;

import com.cronpilot.scheduler.service.InvalidRunTransitionException;
import com.cronpilot.scheduler.service.JobConflictException;
import com.cronpilot.scheduler.service.JobDisabledException;
import com.cronpilot.scheduler.service.JobNotFoundException;
import com.cronpilot.scheduler.service.JobValidationException;
import com.cronpilot.scheduler.service.RunNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;

/**
 * Maps service exceptions to HTTP status codes with an {"error": "..."} body.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(JobValidationException.class)
    public ResponseEntity<Map<String, String>> badRequest(JobValidationException e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler({JobNotFoundException.class, RunNotFoundException.class})
    public ResponseEntity<Map<String, String>> notFound(RuntimeException e) {
        return error(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler({JobConflictException.class, JobDisabledException.class, InvalidRunTransitionException.class})
    public ResponseEntity<Map<String, String>> conflict(RuntimeException e) {
        log.info("Request rejected: {}", e.getMessage());
        return error(HttpStatus.CONFLICT, e.getMessage());
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, String>> status(ResponseStatusException e) {
        return error(HttpStatus.valueOf(e.getStatusCode().value()), e.getReason());
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("error", message == null ? status.getReasonPhrase() : message));
    }
}
