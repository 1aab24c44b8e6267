package com.traceradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Jetton wallet known to the indexer, keyed by the wallet's raw address.
 */
@Document(collection = "jetton_wallets")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class JettonWallet {

    /** Raw wallet address, see {@link AccountId#toRaw()}. */
    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed
    private AccountId master;
    private AccountId owner;
    private Instant updatedAt;
}
