package com.traceradar.ingestion.source;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.traceradar.domain.AccountId;
import com.traceradar.domain.NftSaleContract;
import com.traceradar.ingestion.pipeline.enrichment.InformationSource;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Caffeine-backed front for another source. Misses of one call are forwarded to the delegate as a
 * single batch; absent results are cached too, so unknown addresses are not re-queried until TTL.
 */
public class CachingInformationSource implements InformationSource {

    private final InformationSource delegate;
    private final Cache<AccountId, Optional<AccountId>> jettonMasters;
    private final Cache<AccountId, Optional<NftSaleContract>> getGemsSales;
    private final Cache<AccountId, Optional<NftSaleContract>> basicSales;

    public CachingInformationSource(InformationSource delegate, Duration ttl, long maximumSize) {
        this.delegate = delegate;
        this.jettonMasters = newCache(ttl, maximumSize);
        this.getGemsSales = newCache(ttl, maximumSize);
        this.basicSales = newCache(ttl, maximumSize);
    }

    private static <V> Cache<AccountId, Optional<V>> newCache(Duration ttl, long maximumSize) {
        return Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(maximumSize)
                .build();
    }

    @Override
    public Mono<Map<AccountId, AccountId>> jettonMastersForWallets(List<AccountId> wallets) {
        return cached(wallets, jettonMasters, delegate::jettonMastersForWallets);
    }

    @Override
    public Mono<Map<AccountId, NftSaleContract>> getGemsContracts(List<AccountId> contracts) {
        return cached(contracts, getGemsSales, delegate::getGemsContracts);
    }

    @Override
    public Mono<Map<AccountId, NftSaleContract>> nftSaleContracts(List<AccountId> contracts) {
        return cached(contracts, basicSales, delegate::nftSaleContracts);
    }

    private static <V> Mono<Map<AccountId, V>> cached(List<AccountId> keys,
                                                      Cache<AccountId, Optional<V>> cache,
                                                      Function<List<AccountId>, Mono<Map<AccountId, V>>> loader) {
        return Mono.defer(() -> {
            Map<AccountId, V> result = new HashMap<>();
            List<AccountId> misses = new ArrayList<>();
            for (AccountId key : new LinkedHashSet<>(keys)) {
                Optional<V> hit = cache.getIfPresent(key);
                if (hit == null) {
                    misses.add(key);
                } else {
                    hit.ifPresent(value -> result.put(key, value));
                }
            }
            if (misses.isEmpty()) {
                return Mono.just(result);
            }
            return loader.apply(misses)
                    .defaultIfEmpty(Map.of())
                    .map(loaded -> {
                        for (AccountId key : misses) {
                            V value = loaded.get(key);
                            cache.put(key, Optional.ofNullable(value));
                            if (value != null) {
                                result.put(key, value);
                            }
                        }
                        return result;
                    });
        });
    }
}
