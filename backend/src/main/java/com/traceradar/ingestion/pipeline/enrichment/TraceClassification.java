package com.traceradar.ingestion.pipeline.enrichment;

import com.traceradar.domain.ContractInterface;
import com.traceradar.domain.DecodedBody;
import com.traceradar.domain.Message;
import com.traceradar.domain.Trace;

/**
 * Node predicates shared by the candidate walk and the assignment walk.
 */
final class TraceClassification {

    private TraceClassification() {
    }

    /** Inbound message is a decoded JettonTransfer with a destination. */
    static boolean isDestinationJettonWallet(Message inMsg) {
        if (inMsg == null || inMsg.getDecodedBody() == null) {
            return false;
        }
        return inMsg.getDecodedBody().isOperation(DecodedBody.JETTON_TRANSFER) && inMsg.getDestination() != null;
    }

    static boolean isSaleContract(Trace trace, ContractInterface saleInterface) {
        return trace.hasInterface(saleInterface) && trace.getAccount() != null;
    }

    static Message inMsg(Trace trace) {
        return trace.getTransaction() != null ? trace.getTransaction().getInMsg() : null;
    }
}
