package com.traceradar.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.traceradar.domain.Transaction;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TransactionResponse(
        String hash,
        long lt,
        String account,
        long utime,
        boolean success,
        long totalFee,
        MessageResponse inMsg,
        /** Outbound messages not matched to a child node. */
        List<MessageResponse> outMsgs
) {

    public static TransactionResponse from(Transaction tx) {
        return new TransactionResponse(
                tx.getHash(),
                tx.getLt(),
                MessageResponse.raw(tx.getAccount()),
                tx.getUtime(),
                tx.isSuccess(),
                tx.getTotalFee(),
                MessageResponse.from(tx.getInMsg()),
                tx.getOutMsgs().stream().map(MessageResponse::from).toList());
    }
}
