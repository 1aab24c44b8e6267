package com.traceradar.ingestion.source;

import com.traceradar.domain.AccountId;
import com.traceradar.domain.NftSaleContract;
import com.traceradar.ingestion.pipeline.enrichment.InformationSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static com.traceradar.domain.TraceFixtures.account;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CachingInformationSourceTest {

    @Mock
    private InformationSource delegate;

    private CachingInformationSource cachingSource;

    @BeforeEach
    void setUp() {
        cachingSource = new CachingInformationSource(delegate, Duration.ofMinutes(1), 1_000);
    }

    @Test
    @DisplayName("hits are served locally; only misses reach the delegate, deduplicated, in one batch")
    void forwardsOnlyMisses() {
        AccountId a = account(1);
        AccountId b = account(2);
        AccountId c = account(3);
        when(delegate.jettonMastersForWallets(List.of(a, b))).thenReturn(Mono.just(Map.of(a, account(100))));
        when(delegate.jettonMastersForWallets(List.of(c))).thenReturn(Mono.just(Map.of(c, account(101))));

        StepVerifier.create(cachingSource.jettonMastersForWallets(List.of(a, b, a)))
                .expectNext(Map.of(a, account(100)))
                .verifyComplete();
        StepVerifier.create(cachingSource.jettonMastersForWallets(List.of(a, b, c)))
                .expectNext(Map.of(a, account(100), c, account(101)))
                .verifyComplete();

        verify(delegate).jettonMastersForWallets(List.of(a, b));
        verify(delegate).jettonMastersForWallets(List.of(c));
    }

    @Test
    @DisplayName("fully cached request does not call the delegate; unknown keys are cached as absent")
    void negativeCaching() {
        AccountId sale = account(5);
        when(delegate.nftSaleContracts(List.of(sale))).thenReturn(Mono.empty());

        StepVerifier.create(cachingSource.nftSaleContracts(List.of(sale))).expectNext(Map.of()).verifyComplete();
        StepVerifier.create(cachingSource.nftSaleContracts(List.of(sale))).expectNext(Map.of()).verifyComplete();

        verify(delegate, times(1)).nftSaleContracts(anyList());
    }

    @Test
    @DisplayName("the two sale kinds use separate caches")
    void separateCachesPerKind() {
        AccountId sale = account(6);
        NftSaleContract getgems = new NftSaleContract(10L, account(7));
        when(delegate.getGemsContracts(List.of(sale))).thenReturn(Mono.just(Map.of(sale, getgems)));
        when(delegate.nftSaleContracts(List.of(sale))).thenReturn(Mono.just(Map.of()));

        StepVerifier.create(cachingSource.getGemsContracts(List.of(sale))).expectNext(Map.of(sale, getgems)).verifyComplete();
        StepVerifier.create(cachingSource.nftSaleContracts(List.of(sale))).expectNext(Map.of()).verifyComplete();
    }

    @Test
    @DisplayName("delegate errors propagate and nothing is cached")
    void errorsPropagate() {
        AccountId wallet = account(8);
        IllegalStateException failure = new IllegalStateException("down");
        when(delegate.jettonMastersForWallets(List.of(wallet)))
                .thenReturn(Mono.error(failure))
                .thenReturn(Mono.just(Map.of(wallet, account(9))));

        StepVerifier.create(cachingSource.jettonMastersForWallets(List.of(wallet))).expectErrorMatches(failure::equals).verify();
        StepVerifier.create(cachingSource.jettonMastersForWallets(List.of(wallet)))
                .expectNext(Map.of(wallet, account(9)))
                .verifyComplete();
    }

    @Test
    @DisplayName("empty request completes with an empty map without calling the delegate")
    void emptyRequest() {
        StepVerifier.create(cachingSource.getGemsContracts(List.of())).expectNext(Map.of()).verifyComplete();

        verify(delegate, never()).getGemsContracts(anyList());
    }
}
