package com.traceradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * Information about a trace node that is not contained in its transaction.
 */
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode
@ToString
public class TraceAdditionalInfo {

    /** Set when the inbound message is a jetton transfer to a wallet of a known master. */
    private AccountId jettonMaster;
    /** Set when the account implements get_sale_data and sale data is known. */
    private NftSaleContract nftSaleContract;
}
