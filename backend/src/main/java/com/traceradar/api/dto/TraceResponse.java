package com.traceradar.api.dto;

import com.traceradar.query.TraceView;

/**
 * GET /v2/traces/{hash}. inProgress = the trace may still grow.
 */
public record TraceResponse(String hash, boolean inProgress, TraceNodeResponse trace) {

    public static TraceResponse from(TraceView view) {
        return new TraceResponse(view.trace().getId(), view.inProgress(), TraceNodeResponse.from(view.trace()));
    }
}
