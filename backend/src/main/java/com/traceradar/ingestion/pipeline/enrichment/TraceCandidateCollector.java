package com.traceradar.ingestion.pipeline.enrichment;

import com.traceradar.domain.AccountId;
import com.traceradar.domain.ContractInterface;
import com.traceradar.domain.Message;
import com.traceradar.domain.Trace;

import java.util.ArrayList;
import java.util.List;

/**
 * Single pre-order walk sorting trace nodes into lookup categories.
 * A node can land in several lists: the categories are independent.
 */
public final class TraceCandidateCollector {

    private TraceCandidateCollector() {
    }

    public static EnrichmentCandidates collect(Trace root) {
        List<AccountId> jettonWallets = new ArrayList<>();
        List<AccountId> getgemsSales = new ArrayList<>();
        List<AccountId> basicSales = new ArrayList<>();
        root.visit(trace -> {
            Message inMsg = TraceClassification.inMsg(trace);
            if (TraceClassification.isDestinationJettonWallet(inMsg)) {
                jettonWallets.add(inMsg.getDestination());
            }
            if (TraceClassification.isSaleContract(trace, ContractInterface.NFT_SALE_GETGEMS)) {
                getgemsSales.add(trace.getAccount());
            }
            if (TraceClassification.isSaleContract(trace, ContractInterface.NFT_SALE)) {
                basicSales.add(trace.getAccount());
            }
        });
        return new EnrichmentCandidates(jettonWallets, getgemsSales, basicSales);
    }
}
