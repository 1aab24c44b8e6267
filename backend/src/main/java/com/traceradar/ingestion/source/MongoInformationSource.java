package com.traceradar.ingestion.source;

import com.traceradar.domain.AccountId;
import com.traceradar.domain.JettonWallet;
import com.traceradar.domain.JettonWalletRepository;
import com.traceradar.domain.NftSale;
import com.traceradar.domain.NftSaleContract;
import com.traceradar.domain.NftSaleRepository;
import com.traceradar.domain.SaleContractKind;
import com.traceradar.ingestion.pipeline.enrichment.InformationSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Resolves enrichment data from the indexer's jetton_wallets and nft_sales collections.
 * One $in query per call; blocking repository calls run on the bounded-elastic scheduler.
 */
@Slf4j
@RequiredArgsConstructor
public class MongoInformationSource implements InformationSource {

    private final JettonWalletRepository jettonWalletRepository;
    private final NftSaleRepository nftSaleRepository;

    @Override
    public Mono<Map<AccountId, AccountId>> jettonMastersForWallets(List<AccountId> wallets) {
        Set<String> ids = rawIds(wallets);
        if (ids.isEmpty()) {
            return Mono.just(Map.of());
        }
        return Mono.fromCallable(() -> {
            Map<AccountId, AccountId> masters = new HashMap<>();
            for (JettonWallet wallet : jettonWalletRepository.findAllById(ids)) {
                if (wallet.getMaster() != null) {
                    masters.put(AccountId.parse(wallet.getId()), wallet.getMaster());
                }
            }
            log.debug("Resolved {} of {} jetton wallets", masters.size(), ids.size());
            return masters;
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<Map<AccountId, NftSaleContract>> getGemsContracts(List<AccountId> contracts) {
        return saleContracts(contracts, SaleContractKind.GETGEMS);
    }

    @Override
    public Mono<Map<AccountId, NftSaleContract>> nftSaleContracts(List<AccountId> contracts) {
        return saleContracts(contracts, SaleContractKind.BASIC);
    }

    private Mono<Map<AccountId, NftSaleContract>> saleContracts(List<AccountId> contracts, SaleContractKind kind) {
        Set<String> ids = rawIds(contracts);
        if (ids.isEmpty()) {
            return Mono.just(Map.of());
        }
        return Mono.fromCallable(() -> {
            Map<AccountId, NftSaleContract> sales = new HashMap<>();
            for (NftSale sale : nftSaleRepository.findByIdInAndKind(ids, kind)) {
                sales.put(AccountId.parse(sale.getId()), sale.toSaleContract());
            }
            log.debug("Resolved {} of {} {} sale contracts", sales.size(), ids.size(), kind);
            return sales;
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private static Set<String> rawIds(List<AccountId> accounts) {
        Set<String> ids = new LinkedHashSet<>();
        for (AccountId account : accounts) {
            ids.add(account.toRaw());
        }
        return ids;
    }
}
