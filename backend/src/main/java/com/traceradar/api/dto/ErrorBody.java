package com.traceradar.api.dto;

import java.time.Instant;

/**
 * Error response of every API failure: error (machine code such as NOT_FOUND or INVALID_ACCOUNT),
 * message, timestamp (ISO 8601).
 */
public record ErrorBody(String error, String message, Instant timestamp) {

    /**
     * Creates an error body with timestamp set to now (UTC).
     */
    public static ErrorBody of(String error, String message) {
        return new ErrorBody(error, message, Instant.now());
    }
}
