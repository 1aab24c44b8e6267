package com.traceradar.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.traceradar.streaming.TransactionEvent;

/**
 * SSE payload of a "transaction" event.
 */
public record TransactionEventResponse(
        @JsonProperty("account_id") String accountId,
        @JsonProperty("lt") long lt,
        @JsonProperty("tx_hash") String txHash
) {

    public static TransactionEventResponse from(TransactionEvent event) {
        return new TransactionEventResponse(event.account().toRaw(), event.lt(), event.txHash());
    }
}
