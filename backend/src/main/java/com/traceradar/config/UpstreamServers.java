package com.traceradar.config;

import java.util.List;

/**
 * Parsed upstream endpoints and the network this instance serves.
 */
public record UpstreamServers(List<LiteServer> liteServers, List<LiteServer> sendingLiteServers, boolean testnet) {

    public UpstreamServers {
        liteServers = List.copyOf(liteServers);
        sendingLiteServers = List.copyOf(sendingLiteServers);
    }
}
