package com.traceradar.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.traceradar.domain.NftSaleContract;
import com.traceradar.domain.TraceAdditionalInfo;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AdditionalInfoResponse(String jettonMaster, NftSaleResponse nftSaleContract) {

    public static AdditionalInfoResponse from(TraceAdditionalInfo info) {
        if (info == null) {
            return null;
        }
        NftSaleContract sale = info.getNftSaleContract();
        return new AdditionalInfoResponse(
                MessageResponse.raw(info.getJettonMaster()),
                sale != null ? new NftSaleResponse(sale.nftPrice(), MessageResponse.raw(sale.owner())) : null);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record NftSaleResponse(long nftPrice, String owner) {
    }
}
