package com.traceradar.api.dto;

import com.traceradar.domain.AccountId;
import com.traceradar.streaming.TraceEvent;

import java.util.List;

/**
 * SSE payload of a "trace" event.
 */
public record TraceEventResponse(List<String> accounts, String hash) {

    public static TraceEventResponse from(TraceEvent event) {
        return new TraceEventResponse(
                event.accounts().stream().sorted().map(AccountId::toRaw).toList(),
                event.hash());
    }
}
