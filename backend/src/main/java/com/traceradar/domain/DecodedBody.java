package com.traceradar.domain;

/**
 * Message body as decoded upstream by the ABI decoder: 32-bit op code and operation name.
 */
public record DecodedBody(long opCode, String operation) {

    public static final String JETTON_TRANSFER = "JettonTransfer";
    public static final long JETTON_TRANSFER_OP_CODE = 0x0f8a7ea5L;

    public static DecodedBody jettonTransfer() {
        return new DecodedBody(JETTON_TRANSFER_OP_CODE, JETTON_TRANSFER);
    }

    public boolean isOperation(String name) {
        return name != null && name.equals(operation);
    }
}
