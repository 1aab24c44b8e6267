package com.traceradar.api.controller;

import com.traceradar.domain.ContractInterface;
import com.traceradar.domain.NftSaleContract;
import com.traceradar.domain.Trace;
import com.traceradar.domain.TraceAdditionalInfo;
import com.traceradar.query.EnrichmentFailedException;
import com.traceradar.query.TraceQueryService;
import com.traceradar.query.TraceView;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.TimeoutException;

import static com.traceradar.domain.TraceFixtures.account;
import static com.traceradar.domain.TraceFixtures.jettonTransferTo;
import static com.traceradar.domain.TraceFixtures.node;
import static com.traceradar.domain.TraceFixtures.txHash;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@WebFluxTest(controllers = TraceController.class)
class TraceControllerTest {

    @Autowired
    WebTestClient webTestClient;

    @MockBean
    TraceQueryService traceQueryService;

    @Test
    @DisplayName("returns the enriched trace tree with in-progress flag")
    void returnsTrace() {
        Trace child = node(2, account(2), jettonTransferTo(account(10)), List.of(ContractInterface.JETTON_WALLET));
        Trace sale = node(3, account(3), null, List.of(ContractInterface.NFT_SALE));
        Trace root = node(1, account(1), child, sale);
        root.setAdditionalInfo(new TraceAdditionalInfo());
        TraceAdditionalInfo childInfo = new TraceAdditionalInfo();
        childInfo.setJettonMaster(account(11));
        child.setAdditionalInfo(childInfo);
        TraceAdditionalInfo saleInfo = new TraceAdditionalInfo();
        saleInfo.setNftSaleContract(new NftSaleContract(1_500_000_000L, account(12)));
        sale.setAdditionalInfo(saleInfo);
        when(traceQueryService.findTrace(txHash(1))).thenReturn(Mono.just(new TraceView(root, false)));

        webTestClient.get()
                .uri("/v2/traces/{hash}", txHash(1))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.hash").isEqualTo(txHash(1))
                .jsonPath("$.inProgress").isEqualTo(false)
                .jsonPath("$.trace.transaction.account").isEqualTo(account(1).toRaw())
                .jsonPath("$.trace.interfaces[0]").isEqualTo("wallet")
                .jsonPath("$.trace.children.length()").isEqualTo(2)
                .jsonPath("$.trace.children[0].transaction.inMsg.opCode").isEqualTo("0x0f8a7ea5")
                .jsonPath("$.trace.children[0].transaction.inMsg.operation").isEqualTo("JettonTransfer")
                .jsonPath("$.trace.children[0].additionalInfo.jettonMaster").isEqualTo(account(11).toRaw())
                .jsonPath("$.trace.children[1].additionalInfo.nftSaleContract.nftPrice").isEqualTo(1_500_000_000L)
                .jsonPath("$.trace.children[1].additionalInfo.nftSaleContract.owner").isEqualTo(account(12).toRaw());
    }

    @Test
    @DisplayName("upper-case hash is normalized before lookup")
    void normalizesHash() {
        when(traceQueryService.findTrace(txHash(1))).thenReturn(Mono.empty());

        webTestClient.get()
                .uri("/v2/traces/{hash}", txHash(1).toUpperCase())
                .exchange()
                .expectStatus().isNotFound();

        verify(traceQueryService).findTrace(txHash(1));
    }

    @Test
    @DisplayName("unknown trace returns 404 ErrorBody")
    void notFound() {
        when(traceQueryService.findTrace(anyString())).thenReturn(Mono.empty());

        webTestClient.get()
                .uri("/v2/traces/{hash}", txHash(5))
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error").isEqualTo("NOT_FOUND")
                .jsonPath("$.timestamp").exists();
    }

    @Test
    @DisplayName("malformed hash returns 400 without querying")
    void invalidHash() {
        webTestClient.get()
                .uri("/v2/traces/{hash}", "not-a-hash")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_HASH");

        verify(traceQueryService, never()).findTrace(anyString());
    }

    @Test
    @DisplayName("enrichment failure returns 503")
    void enrichmentUnavailable() {
        when(traceQueryService.findTrace(txHash(6)))
                .thenReturn(Mono.error(new EnrichmentFailedException(txHash(6), new TimeoutException())));

        webTestClient.get()
                .uri("/v2/traces/{hash}", txHash(6))
                .exchange()
                .expectStatus().isEqualTo(503)
                .expectBody()
                .jsonPath("$.error").isEqualTo("ENRICHMENT_UNAVAILABLE");
    }
}
