package com.traceradar.query;

/**
 * The information source failed while a trace was being prepared for serving.
 */
public class EnrichmentFailedException extends RuntimeException {

    private final String traceId;

    public EnrichmentFailedException(String traceId, Throwable cause) {
        super("Enrichment failed for trace " + traceId, cause);
        this.traceId = traceId;
    }

    public String getTraceId() {
        return traceId;
    }
}
