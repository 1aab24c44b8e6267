package com.traceradar.api.controller;

import com.traceradar.api.dto.TraceEventResponse;
import com.traceradar.api.dto.TransactionEventResponse;
import com.traceradar.config.MonitoredAccounts;
import com.traceradar.domain.AccountId;
import com.traceradar.streaming.StreamingHub;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Server-Sent-Events for monitored accounts: finalized traces and their transactions.
 * accounts = comma-separated addresses (raw or user-friendly), or ALL for every monitored account.
 */
@RestController
@RequestMapping("/v2/sse/accounts")
@RequiredArgsConstructor
@Slf4j
public class StreamingController {

    static final String ALL_ACCOUNTS = "ALL";
    private static final Duration HEARTBEAT_INTERVAL = Duration.ofSeconds(5);

    private final StreamingHub streamingHub;
    private final MonitoredAccounts monitoredAccounts;

    @GetMapping(value = "/traces", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<TraceEventResponse>> traces(@RequestParam String accounts) {
        Set<AccountId> subscribed = resolveAccounts(accounts);
        log.debug("SSE traces subscription for {} accounts", subscribed.size());
        Flux<ServerSentEvent<TraceEventResponse>> events = streamingHub.traces(subscribed)
                .map(event -> ServerSentEvent.builder(TraceEventResponse.from(event))
                        .event("trace")
                        .id(event.hash())
                        .build());
        return withHeartbeat(events)
                .doOnCancel(() -> log.debug("SSE traces subscription cancelled"));
    }

    @GetMapping(value = "/transactions", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<TransactionEventResponse>> transactions(@RequestParam String accounts) {
        Set<AccountId> subscribed = resolveAccounts(accounts);
        log.debug("SSE transactions subscription for {} accounts", subscribed.size());
        Flux<ServerSentEvent<TransactionEventResponse>> events = streamingHub.transactions(subscribed)
                .map(event -> ServerSentEvent.builder(TransactionEventResponse.from(event))
                        .event("transaction")
                        .id(event.txHash())
                        .build());
        return withHeartbeat(events)
                .doOnCancel(() -> log.debug("SSE transactions subscription cancelled"));
    }

    private static <T> Flux<ServerSentEvent<T>> withHeartbeat(Flux<ServerSentEvent<T>> events) {
        Flux<ServerSentEvent<T>> heartbeat = Flux.interval(HEARTBEAT_INTERVAL)
                .map(tick -> ServerSentEvent.<T>builder().comment("heartbeat").build());
        return Flux.merge(events, heartbeat);
    }

    Set<AccountId> resolveAccounts(String accounts) {
        if (accounts == null || accounts.isBlank()) {
            throw new ApiRequestException("INVALID_ACCOUNT", "accounts parameter is required");
        }
        if (ALL_ACCOUNTS.equalsIgnoreCase(accounts.trim())) {
            return monitoredAccounts.all();
        }
        Set<AccountId> result = new LinkedHashSet<>();
        for (String part : accounts.split(",")) {
            if (part.isBlank()) {
                continue;
            }
            Optional<AccountId> account = AccountId.tryParse(part);
            if (account.isEmpty()) {
                throw new ApiRequestException("INVALID_ACCOUNT", "Invalid account address: " + part.trim());
            }
            if (!monitoredAccounts.contains(account.get())) {
                throw new ApiRequestException("ACCOUNT_NOT_MONITORED", "Account is not monitored: " + account.get());
            }
            result.add(account.get());
        }
        if (result.isEmpty()) {
            throw new ApiRequestException("INVALID_ACCOUNT", "accounts parameter is required");
        }
        return result;
    }
}
