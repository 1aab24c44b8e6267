package com.traceradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

/**
 * Persistence for jetton_wallets. Batched lookups go through findAllById.
 */
public interface JettonWalletRepository extends MongoRepository<JettonWallet, String> {
}
