package com.traceradar.ingestion.pipeline.enrichment;

import com.traceradar.domain.AccountId;
import com.traceradar.domain.NftSaleContract;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Batched lookups used to build {@link com.traceradar.domain.TraceAdditionalInfo}.
 * Each call receives every candidate of one kind found in a trace (duplicates possible).
 * Unknown keys are left out of the result map; an error aborts the whole enrichment.
 */
public interface InformationSource {

    /** Jetton wallet address → its jetton master. */
    Mono<Map<AccountId, AccountId>> jettonMastersForWallets(List<AccountId> wallets);

    /** Getgems sale contract address → its sale data. */
    Mono<Map<AccountId, NftSaleContract>> getGemsContracts(List<AccountId> contracts);

    /** Basic nft_sale contract address → its sale data. */
    Mono<Map<AccountId, NftSaleContract>> nftSaleContracts(List<AccountId> contracts);
}
