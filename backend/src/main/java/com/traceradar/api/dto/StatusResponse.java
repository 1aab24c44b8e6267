package com.traceradar.api.dto;

public record StatusResponse(
        boolean testnet,
        int monitoredAccounts,
        int liteServers,
        int sendingLiteServers,
        boolean enrichmentEnabled,
        int traceSubscribers,
        int transactionSubscribers
) {
}
