package com.traceradar.ingestion.pipeline.enrichment;

import com.traceradar.domain.AccountId;

import java.util.List;

/**
 * Addresses to resolve for one trace, in pre-order, duplicates kept.
 */
public record EnrichmentCandidates(
        List<AccountId> jettonWallets,
        List<AccountId> getgemsSales,
        List<AccountId> basicSales
) {

    public EnrichmentCandidates {
        jettonWallets = List.copyOf(jettonWallets);
        getgemsSales = List.copyOf(getgemsSales);
        basicSales = List.copyOf(basicSales);
    }
}
