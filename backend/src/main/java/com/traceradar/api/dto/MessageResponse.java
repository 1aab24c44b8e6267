package com.traceradar.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.traceradar.domain.AccountId;
import com.traceradar.domain.DecodedBody;
import com.traceradar.domain.Message;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record MessageResponse(
        String msgType,
        String source,
        String destination,
        long value,
        long createdLt,
        String opCode,
        String operation
) {

    public static MessageResponse from(Message message) {
        if (message == null) {
            return null;
        }
        DecodedBody body = message.getDecodedBody();
        return new MessageResponse(
                message.getMsgType() != null ? message.getMsgType().name() : null,
                raw(message.getSource()),
                raw(message.getDestination()),
                message.getValue(),
                message.getCreatedLt(),
                body != null ? String.format("0x%08x", body.opCode()) : null,
                body != null ? body.operation() : null);
    }

    static String raw(AccountId account) {
        return account != null ? account.toRaw() : null;
    }
}
