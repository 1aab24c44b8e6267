package com.traceradar.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.traceradar.domain.ContractInterface;
import com.traceradar.domain.Trace;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TraceNodeResponse(
        TransactionResponse transaction,
        List<String> interfaces,
        AdditionalInfoResponse additionalInfo,
        List<TraceNodeResponse> children
) {

    public static TraceNodeResponse from(Trace trace) {
        return new TraceNodeResponse(
                TransactionResponse.from(trace.getTransaction()),
                trace.getAccountInterfaces().stream().map(ContractInterface::getAbiName).toList(),
                AdditionalInfoResponse.from(trace.getAdditionalInfo()),
                trace.getChildren().stream().map(TraceNodeResponse::from).toList());
    }
}
