package com.traceradar.ingestion.pipeline.enrichment;

import com.traceradar.domain.AccountId;
import com.traceradar.domain.ContractInterface;
import com.traceradar.domain.Message;
import com.traceradar.domain.NftSaleContract;
import com.traceradar.domain.Trace;
import com.traceradar.domain.TraceAdditionalInfo;
import com.traceradar.ingestion.config.EnrichmentProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;

/**
 * Populates {@link Trace#getAdditionalInfo()} for every node of a trace.
 * <p>
 * One walk collects candidates, then exactly one batched query per kind is issued, in order:
 * jetton masters, getgems sales, basic sales. Only when all three succeed does a second walk
 * give each node a fresh {@link TraceAdditionalInfo}; on any error no node is touched.
 * A node implementing both sale interfaces ends up with the basic sale data.
 */
@Component
@Slf4j
public class TraceAdditionalInfoEnricher {

    private final InformationSource defaultSource;
    private final Duration timeout;

    @Autowired
    public TraceAdditionalInfoEnricher(ObjectProvider<InformationSource> informationSource,
                                       EnrichmentProperties properties) {
        this(informationSource.getIfAvailable(), properties.getTimeout());
    }

    TraceAdditionalInfoEnricher(InformationSource defaultSource, Duration timeout) {
        this.defaultSource = defaultSource;
        this.timeout = timeout;
    }

    /** False when no information source is configured and {@link #enrich} is a no-op. */
    public boolean isEnabled() {
        return defaultSource != null;
    }

    /**
     * Enriches with the application's configured source. No-op when enrichment is disabled.
     */
    public Mono<Void> enrich(Trace trace) {
        return collectAdditionalInfo(defaultSource, trace);
    }

    /**
     * @param informationSource null means degraded mode: completes immediately, tree untouched
     * @return completes when every node has been annotated; errors with the first failing query's error
     */
    public Mono<Void> collectAdditionalInfo(InformationSource informationSource, Trace trace) {
        if (informationSource == null) {
            return Mono.empty();
        }
        return Mono.defer(() -> {
            EnrichmentCandidates candidates = TraceCandidateCollector.collect(trace);
            log.debug("Enriching trace {}: {} jetton wallets, {} getgems sales, {} basic sales",
                    trace.getId(), candidates.jettonWallets().size(),
                    candidates.getgemsSales().size(), candidates.basicSales().size());
            return boundedByTimeout(resolve(informationSource, candidates))
                    .doOnNext(resolved -> assign(trace, resolved))
                    .then();
        });
    }

    private static Mono<ResolvedInfo> resolve(InformationSource source, EnrichmentCandidates candidates) {
        return source.jettonMastersForWallets(candidates.jettonWallets())
                .defaultIfEmpty(Map.of())
                .flatMap(masters -> source.getGemsContracts(candidates.getgemsSales())
                        .defaultIfEmpty(Map.of())
                        .flatMap(getGems -> source.nftSaleContracts(candidates.basicSales())
                                .defaultIfEmpty(Map.of())
                                .map(basic -> new ResolvedInfo(masters, getGems, basic))));
    }

    private Mono<ResolvedInfo> boundedByTimeout(Mono<ResolvedInfo> queries) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return queries;
        }
        return queries.timeout(timeout);
    }

    private static void assign(Trace root, ResolvedInfo resolved) {
        root.visit(trace -> {
            TraceAdditionalInfo info = new TraceAdditionalInfo();
            Message inMsg = TraceClassification.inMsg(trace);
            if (TraceClassification.isDestinationJettonWallet(inMsg)) {
                AccountId master = resolved.jettonMasters().get(inMsg.getDestination());
                if (master != null) {
                    info.setJettonMaster(master);
                }
            }
            if (TraceClassification.isSaleContract(trace, ContractInterface.NFT_SALE_GETGEMS)) {
                NftSaleContract sale = resolved.getGemsSales().get(trace.getAccount());
                if (sale != null) {
                    info.setNftSaleContract(sale);
                }
            }
            if (TraceClassification.isSaleContract(trace, ContractInterface.NFT_SALE)) {
                NftSaleContract sale = resolved.basicSales().get(trace.getAccount());
                if (sale != null) {
                    info.setNftSaleContract(sale);
                }
            }
            trace.setAdditionalInfo(info);
        });
    }

    private record ResolvedInfo(
            Map<AccountId, AccountId> jettonMasters,
            Map<AccountId, NftSaleContract> getGemsSales,
            Map<AccountId, NftSaleContract> basicSales
    ) {
    }
}
