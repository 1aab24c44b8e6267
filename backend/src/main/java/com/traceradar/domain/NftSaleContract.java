package com.traceradar.domain;

/**
 * Partial result of a sale contract's get_sale_data: full price in nanotons and the NFT owner, if known.
 */
public record NftSaleContract(long nftPrice, AccountId owner) {
}
