package com.traceradar.domain;

/**
 * Capability tags an account is known to implement (detected by get-method probing upstream).
 * Classification is membership in a node's tag list, never a type hierarchy.
 */
public enum ContractInterface {
    WALLET("wallet"),
    JETTON_MASTER("jetton_master"),
    JETTON_WALLET("jetton_wallet"),
    NFT_COLLECTION("nft_collection"),
    NFT_ITEM("nft_item"),
    /** Generic NFT sale contract exposing get_sale_data. */
    NFT_SALE("nft_sale"),
    /** Getgems marketplace flavour of the sale contract. */
    NFT_SALE_GETGEMS("nft_sale_getgems");

    private final String abiName;

    ContractInterface(String abiName) {
        this.abiName = abiName;
    }

    public String getAbiName() {
        return abiName;
    }
}
