package com.traceradar.api.controller;

public class TraceNotFoundException extends RuntimeException {

    public TraceNotFoundException(String hash) {
        super("Trace not found: " + hash);
    }
}
