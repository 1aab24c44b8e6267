package com.traceradar.api.controller;

import com.traceradar.api.dto.TraceResponse;
import com.traceradar.query.TraceQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * GET /v2/traces/{hash}: enriched trace tree by root transaction hash.
 */
@RestController
@RequestMapping("/v2/traces")
@RequiredArgsConstructor
public class TraceController {

    private static final Pattern TX_HASH = Pattern.compile("^[0-9a-fA-F]{64}$");

    private final TraceQueryService traceQueryService;

    @GetMapping("/{hash}")
    public Mono<TraceResponse> getTrace(@PathVariable String hash) {
        if (hash == null || !TX_HASH.matcher(hash.trim()).matches()) {
            throw new ApiRequestException("INVALID_HASH", "Transaction hash must be 64 hex characters");
        }
        String normalized = hash.trim().toLowerCase(Locale.ROOT);
        return traceQueryService.findTrace(normalized)
                .map(TraceResponse::from)
                .switchIfEmpty(Mono.error(() -> new TraceNotFoundException(normalized)));
    }
}
