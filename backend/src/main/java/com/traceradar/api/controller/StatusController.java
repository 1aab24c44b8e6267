package com.traceradar.api.controller;

import com.traceradar.api.dto.StatusResponse;
import com.traceradar.config.MonitoredAccounts;
import com.traceradar.config.UpstreamServers;
import com.traceradar.ingestion.pipeline.enrichment.TraceAdditionalInfoEnricher;
import com.traceradar.streaming.StreamingHub;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * GET /v2/status: configuration summary of this instance.
 */
@RestController
@RequestMapping("/v2/status")
@RequiredArgsConstructor
public class StatusController {

    private final MonitoredAccounts monitoredAccounts;
    private final UpstreamServers upstreamServers;
    private final TraceAdditionalInfoEnricher enricher;
    private final StreamingHub streamingHub;

    @GetMapping
    public StatusResponse status() {
        return new StatusResponse(
                upstreamServers.testnet(),
                monitoredAccounts.size(),
                upstreamServers.liteServers().size(),
                upstreamServers.sendingLiteServers().size(),
                enricher.isEnabled(),
                streamingHub.traceSubscriberCount(),
                streamingHub.transactionSubscriberCount());
    }
}
