package com.traceradar.api.controller;

/**
 * Rejected request parameters; mapped to 400 with the given error code.
 */
public class ApiRequestException extends RuntimeException {

    private final String error;

    public ApiRequestException(String error, String message) {
        super(message);
        this.error = error;
    }

    public String getError() {
        return error;
    }
}
