package com.traceradar.api.filter;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import org.springframework.web.util.pattern.PathPattern;
import reactor.core.publisher.Mono;

import java.util.concurrent.TimeUnit;

/**
 * Logs method, path, status and duration of every request and records them in the
 * {@value #REQUEST_TIMER} timer, tagged by method, route and status. Streaming requests are
 * logged and timed when the client disconnects.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@Slf4j
public class RequestLoggingWebFilter implements WebFilter {

    public static final String REQUEST_TIMER = "traceradar.api.requests";
    static final String UNMATCHED_ROUTE = "UNMATCHED";

    /** Null when no registry is configured; requests are then only logged. */
    private final MeterRegistry meterRegistry;

    public RequestLoggingWebFilter(ObjectProvider<MeterRegistry> meterRegistry) {
        this.meterRegistry = meterRegistry.getIfAvailable();
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        long startNanos = System.nanoTime();
        String method = exchange.getRequest().getMethod().name();
        String path = exchange.getRequest().getPath().value();
        return chain.filter(exchange)
                .doFinally(signal -> {
                    HttpStatusCode status = exchange.getResponse().getStatusCode();
                    String statusTag = status != null ? String.valueOf(status.value()) : "-";
                    long elapsedNanos = System.nanoTime() - startNanos;
                    log.info("{} {} -> {} in {} ms ({})", method, path, statusTag,
                            TimeUnit.NANOSECONDS.toMillis(elapsedNanos), signal);
                    if (meterRegistry != null) {
                        Timer.builder(REQUEST_TIMER)
                                .tag("method", method)
                                .tag("route", route(exchange))
                                .tag("status", statusTag)
                                .register(meterRegistry)
                                .record(elapsedNanos, TimeUnit.NANOSECONDS);
                    }
                });
    }

    /** Route template rather than the raw path, so trace hashes do not explode tag cardinality. */
    static String route(ServerWebExchange exchange) {
        Object pattern = exchange.getAttribute(HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE);
        if (pattern instanceof PathPattern pathPattern) {
            return pathPattern.getPatternString();
        }
        return UNMATCHED_ROUTE;
    }
}
