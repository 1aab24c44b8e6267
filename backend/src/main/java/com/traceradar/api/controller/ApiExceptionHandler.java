package com.traceradar.api.controller;

import com.traceradar.api.dto.ErrorBody;
import com.traceradar.query.EnrichmentFailedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps API failures to ErrorBody (error, message, timestamp).
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(ApiRequestException.class)
    public ResponseEntity<ErrorBody> handleBadRequest(ApiRequestException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of(ex.getError(), ex.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorBody> handleIllegalArgument(IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_REQUEST", ex.getMessage()));
    }

    @ExceptionHandler(TraceNotFoundException.class)
    public ResponseEntity<ErrorBody> handleNotFound(TraceNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorBody.of("NOT_FOUND", ex.getMessage()));
    }

    @ExceptionHandler(EnrichmentFailedException.class)
    public ResponseEntity<ErrorBody> handleEnrichmentFailed(EnrichmentFailedException ex) {
        log.warn("Serving 503 for trace {}: {}", ex.getTraceId(), ex.getCause() != null ? ex.getCause().toString() : "-");
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ErrorBody.of("ENRICHMENT_UNAVAILABLE", "Trace side-information is temporarily unavailable"));
    }
}
