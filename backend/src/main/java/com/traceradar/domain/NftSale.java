package com.traceradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Last known get_sale_data snapshot of an NFT sale contract, keyed by the contract's raw address.
 */
@Document(collection = "nft_sales")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class NftSale {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private SaleContractKind kind;
    private AccountId marketplace;
    private AccountId nft;
    /** Null while the NFT has not been transferred to the sale contract. */
    private AccountId owner;
    /** Full price in nanotons. */
    private long fullPrice;
    private Instant updatedAt;

    public NftSaleContract toSaleContract() {
        return new NftSaleContract(fullPrice, owner);
    }
}
