package com.traceradar.query;

import com.traceradar.domain.Trace;

/**
 * An enriched trace ready to serve, with its completeness at load time.
 */
public record TraceView(Trace trace, boolean inProgress) {
}
