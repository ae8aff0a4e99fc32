package com.strategist.dispatch.api;

import com.strategist.core.config.ConfigurationException;
import com.strategist.core.graph.PlanValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps planner exceptions to API error responses: rejected input is a 400,
 * broken configuration a 500.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(PlanValidationException.class)
    public ResponseEntity<ErrorResponse> planValidation(PlanValidationException e) {
        log.warn("Rejected plan input: {}", e.getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponse(e.getMessage(), e.getOffendingIds()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> unreadable(HttpMessageNotReadableException e) {
        log.warn("Unreadable plan request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(ErrorResponse.of("Malformed request body"));
    }

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<ErrorResponse> configuration(ConfigurationException e) {
        log.error("Planner configuration error: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.of(e.getMessage()));
    }
}
