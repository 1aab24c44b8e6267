package com.traceradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Collection;
import java.util.List;

/**
 * Persistence for nft_sales.
 */
public interface NftSaleRepository extends MongoRepository<NftSale, String> {

    List<NftSale> findByIdInAndKind(Collection<String> ids, SaleContractKind kind);
}
