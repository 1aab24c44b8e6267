package com.traceradar.query;

import com.traceradar.domain.TraceRepository;
import com.traceradar.ingestion.pipeline.enrichment.TraceAdditionalInfoEnricher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Loads stored traces and enriches them before they are served.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TraceQueryService {

    private final TraceRepository traceRepository;
    private final TraceAdditionalInfoEnricher enricher;

    /**
     * Empty when no trace is stored under the hash. Errors with {@link EnrichmentFailedException}
     * when side-information could not be resolved; a half-annotated trace is never returned.
     */
    public Mono<TraceView> findTrace(String hash) {
        return Mono.fromCallable(() -> traceRepository.findById(hash).orElse(null))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(trace -> enricher.enrich(trace)
                        .onErrorMap(e -> {
                            log.warn("Enrichment failed for trace {}: {}", hash, e.toString());
                            return new EnrichmentFailedException(hash, e);
                        })
                        .thenReturn(new TraceView(trace, trace.inProgress())));
    }
}
